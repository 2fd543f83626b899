package io.github.drompincen.taskbridge.runtime.resolve;

import io.github.drompincen.taskbridge.protocol.remote.RemoteCompany;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Get-or-create for companies by normalized name. A failed lookup or create is logged and cached
 * as not found; the caller then imports the project without a company.
 */
@Service
public class CompanyResolver {

    private static final Logger log = LoggerFactory.getLogger(CompanyResolver.class);

    private final DestinationApi destination;

    public CompanyResolver(DestinationApi destination) {
        this.destination = destination;
    }

    public Resolution getOrCreate(RunContext ctx, String name) {
        if (Names.isBlank(name)) {
            return Resolution.NOT_FOUND;
        }
        return ctx.cache().resolve(EntityKind.COMPANY, ResolutionCache.GLOBAL, name, () -> {
            String trimmed = name.trim();
            try {
                Optional<RemoteCompany> existing = find(ctx, trimmed);
                if (existing.isPresent()) {
                    return Resolution.of(existing.get().id());
                }
                RemoteCompany created = ctx.executor().execute("companies/modify",
                        () -> destination.createCompany(trimmed));
                log.info("Created company '{}' with id {}", trimmed, created.id());
                return Resolution.of(created.id());
            } catch (RemoteApiException e) {
                log.warn("Could not find or create company '{}': {}", trimmed, e.getMessage());
                return Resolution.NOT_FOUND;
            }
        });
    }

    private Optional<RemoteCompany> find(RunContext ctx, String name) {
        String wanted = Names.normalize(Names.unescape(name));
        return ctx.cache().<RemoteCompany>listing(EntityKind.COMPANY, ResolutionCache.GLOBAL,
                        () -> ctx.executor().execute("companies/list", destination::listCompanies))
                .stream()
                .filter(c -> Names.normalize(Names.unescape(c.name())).equals(wanted))
                .findFirst();
    }
}
