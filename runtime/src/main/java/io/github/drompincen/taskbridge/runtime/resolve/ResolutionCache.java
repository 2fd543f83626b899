package io.github.drompincen.taskbridge.runtime.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Run-scoped memo of name lookups, keyed by entity kind, scope and normalized name.
 * Also memoizes the bulk listings the resolvers search, so each listing is fetched once
 * per scope. Single-threaded by design; owned by the run context.
 */
public class ResolutionCache {

    private static final Logger log = LoggerFactory.getLogger(ResolutionCache.class);

    public static final String GLOBAL = "";

    private final Map<CacheKey, Resolution> entries = new HashMap<>();
    private final Map<ListingKey, List<?>> listings = new HashMap<>();

    private int hits;
    private int misses;

    public Optional<Resolution> lookup(EntityKind kind, String scope, String name) {
        return Optional.ofNullable(entries.get(new CacheKey(kind, scope, Names.normalize(name))));
    }

    /**
     * Returns the cached outcome for the key, or computes and stores it. A {@link Resolution#NOT_FOUND}
     * from the loader is stored too, so the lookup is never repeated within the run.
     */
    public Resolution resolve(EntityKind kind, String scope, String name, Supplier<Resolution> loader) {
        CacheKey key = new CacheKey(kind, scope, Names.normalize(name));
        Resolution cached = entries.get(key);
        if (cached != null) {
            hits++;
            log.debug("Cache hit {} -> {}", key, cached);
            return cached;
        }
        misses++;
        Resolution loaded = loader.get();
        Resolution stored = loaded == null ? Resolution.NOT_FOUND : loaded;
        entries.put(key, stored);
        return stored;
    }

    public void put(EntityKind kind, String scope, String name, Resolution resolution) {
        entries.put(new CacheKey(kind, scope, Names.normalize(name)), resolution);
    }

    @SuppressWarnings("unchecked")
    public <T> List<T> listing(EntityKind kind, String scope, Supplier<List<T>> loader) {
        ListingKey key = new ListingKey(kind, scope);
        List<?> cached = listings.get(key);
        if (cached == null) {
            cached = List.copyOf(loader.get());
            listings.put(key, cached);
            log.debug("Loaded {} {} entries for scope '{}'", cached.size(), kind, scope);
        }
        return (List<T>) cached;
    }

    /** Drops the listing and every name outcome of one scope, e.g. after phases were added to a project. */
    public void invalidateScope(EntityKind kind, String scope) {
        listings.remove(new ListingKey(kind, scope));
        entries.keySet().removeIf(k -> k.kind() == kind && k.scope().equals(scope));
    }

    public int size() {
        return entries.size();
    }

    public int getHits() {
        return hits;
    }

    public int getMisses() {
        return misses;
    }

    public record CacheKey(EntityKind kind, String scope, String name) {}

    private record ListingKey(EntityKind kind, String scope) {}
}
