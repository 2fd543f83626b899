package io.github.drompincen.taskbridge.runtime.resolve;

import io.github.drompincen.taskbridge.protocol.remote.RemoteUser;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Resolves a person's name to a destination user id. Strategies, first match wins:
 * full name, first + last name, first name alone (only for single-word input), email.
 */
@Service
public class UserResolver {

    private static final Logger log = LoggerFactory.getLogger(UserResolver.class);

    private final DestinationApi destination;

    public UserResolver(DestinationApi destination) {
        this.destination = destination;
    }

    public Resolution resolve(RunContext ctx, String name) {
        if (Names.isBlank(name)) {
            return Resolution.NOT_FOUND;
        }
        return ctx.cache().resolve(EntityKind.USER, ResolutionCache.GLOBAL, name, () -> {
            Optional<RemoteUser> match = match(users(ctx), name);
            if (match.isEmpty()) {
                log.warn("No destination user matches '{}'", name);
                return Resolution.NOT_FOUND;
            }
            log.debug("User '{}' resolved to {}", name, match.get().id());
            return Resolution.of(match.get().id());
        });
    }

    /** Resolves every name, dropping the ones that do not match and duplicates. */
    public List<Integer> resolveAll(RunContext ctx, List<String> names) {
        List<Integer> ids = new ArrayList<>();
        for (String name : names) {
            resolve(ctx, name).asOptional()
                    .filter(id -> !ids.contains(id))
                    .ifPresent(ids::add);
        }
        return ids;
    }

    static Optional<RemoteUser> match(List<RemoteUser> users, String name) {
        String needle = Names.normalize(name);
        Optional<RemoteUser> found = firstWhere(users, needle, RemoteUser::fullName);
        if (found.isEmpty()) {
            found = firstWhere(users, needle, RemoteUser::firstLast);
        }
        if (found.isEmpty() && !needle.contains(" ")) {
            found = firstWhere(users, needle, RemoteUser::firstName);
        }
        if (found.isEmpty()) {
            found = firstWhere(users, needle, RemoteUser::email);
        }
        return found;
    }

    private static Optional<RemoteUser> firstWhere(List<RemoteUser> users, String needle,
                                                   Function<RemoteUser, String> field) {
        return users.stream()
                .filter(u -> {
                    String value = field.apply(u);
                    return !Names.isBlank(value) && Names.normalize(value).equals(needle);
                })
                .findFirst();
    }

    private List<RemoteUser> users(RunContext ctx) {
        return ctx.cache().listing(EntityKind.USER, ResolutionCache.GLOBAL,
                () -> ctx.executor().execute("users/list", destination::listUsers));
    }
}
