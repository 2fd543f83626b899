package io.github.drompincen.taskbridge.runtime.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionCacheTest {

    private final ResolutionCache cache = new ResolutionCache();

    @Test
    void secondLookupIsServedFromCache() {
        AtomicInteger loads = new AtomicInteger();

        Resolution first = cache.resolve(EntityKind.USER, ResolutionCache.GLOBAL, "Jane Doe",
                () -> { loads.incrementAndGet(); return Resolution.of(7); });
        Resolution second = cache.resolve(EntityKind.USER, ResolutionCache.GLOBAL, "  jane   DOE ",
                () -> { loads.incrementAndGet(); return Resolution.of(8); });

        assertThat(first.id()).isEqualTo(7);
        assertThat(second.id()).isEqualTo(7);
        assertThat(loads.get()).isEqualTo(1);
        assertThat(cache.getHits()).isEqualTo(1);
    }

    @Test
    void notFoundIsCachedToo() {
        AtomicInteger loads = new AtomicInteger();

        cache.resolve(EntityKind.COMPANY, ResolutionCache.GLOBAL, "Acme",
                () -> { loads.incrementAndGet(); return Resolution.NOT_FOUND; });
        Resolution again = cache.resolve(EntityKind.COMPANY, ResolutionCache.GLOBAL, "Acme",
                () -> { loads.incrementAndGet(); return Resolution.of(1); });

        assertThat(again.isFound()).isFalse();
        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void kindsAndScopesAreSeparate() {
        cache.put(EntityKind.PHASE, "33", "Website Design", Resolution.of(9));

        assertThat(cache.lookup(EntityKind.PHASE, "33", "website design")).contains(Resolution.of(9));
        assertThat(cache.lookup(EntityKind.PHASE, "104", "Website Design")).isEmpty();
        assertThat(cache.lookup(EntityKind.USER, "33", "Website Design")).isEmpty();
    }

    @Test
    void listingIsLoadedOncePerScope() {
        AtomicInteger loads = new AtomicInteger();

        cache.listing(EntityKind.PHASE, "1", () -> { loads.incrementAndGet(); return List.of("a"); });
        List<String> again = cache.listing(EntityKind.PHASE, "1", () -> { loads.incrementAndGet(); return List.of("b"); });
        cache.listing(EntityKind.PHASE, "2", () -> { loads.incrementAndGet(); return List.of("c"); });

        assertThat(again).containsExactly("a");
        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void invalidateScopeDropsListingAndEntriesOfThatScopeOnly() {
        cache.listing(EntityKind.PHASE, "1", () -> List.of("a"));
        cache.put(EntityKind.PHASE, "1", "Design", Resolution.NOT_FOUND);
        cache.put(EntityKind.PHASE, "2", "Design", Resolution.of(4));

        cache.invalidateScope(EntityKind.PHASE, "1");

        assertThat(cache.lookup(EntityKind.PHASE, "1", "Design")).isEmpty();
        assertThat(cache.lookup(EntityKind.PHASE, "2", "Design")).contains(Resolution.of(4));
        assertThat(cache.<String>listing(EntityKind.PHASE, "1", () -> List.of("fresh"))).containsExactly("fresh");
    }
}
