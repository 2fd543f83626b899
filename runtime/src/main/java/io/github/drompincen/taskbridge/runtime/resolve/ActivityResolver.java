package io.github.drompincen.taskbridge.runtime.resolve;

import io.github.drompincen.taskbridge.protocol.remote.RemoteActivity;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.mapping.CategoryMapper;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns a destination activity name, as produced by {@link CategoryMapper}, into an activity id.
 * Unknown names fall back to the {@code Other} activity.
 */
@Service
public class ActivityResolver {

    private static final Logger log = LoggerFactory.getLogger(ActivityResolver.class);

    private final DestinationApi destination;

    public ActivityResolver(DestinationApi destination) {
        this.destination = destination;
    }

    public Resolution resolve(RunContext ctx, String activityName) {
        String name = Names.isBlank(activityName) ? CategoryMapper.FALLBACK : activityName;
        Resolution resolution = lookup(ctx, name);
        if (resolution.isFound() || name.equalsIgnoreCase(CategoryMapper.FALLBACK)) {
            return resolution;
        }
        log.warn("Activity '{}' does not exist in destination, using '{}'", name, CategoryMapper.FALLBACK);
        return lookup(ctx, CategoryMapper.FALLBACK);
    }

    private Resolution lookup(RunContext ctx, String name) {
        return ctx.cache().resolve(EntityKind.ACTIVITY, ResolutionCache.GLOBAL, name, () -> ctx.cache()
                .<RemoteActivity>listing(EntityKind.ACTIVITY, ResolutionCache.GLOBAL,
                        () -> ctx.executor().execute("activities/list", destination::listActivities))
                .stream()
                .filter(a -> Names.normalize(a.name()).equals(Names.normalize(name)))
                .findFirst()
                .map(a -> Resolution.of(a.id()))
                .orElse(Resolution.NOT_FOUND));
    }
}
