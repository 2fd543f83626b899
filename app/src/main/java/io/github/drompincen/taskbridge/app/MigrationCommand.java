package io.github.drompincen.taskbridge.app;

import io.github.drompincen.taskbridge.client.asana.AsanaSettings;
import io.github.drompincen.taskbridge.client.scoro.ScoroSettings;
import io.github.drompincen.taskbridge.runtime.importer.ImportSettings;
import io.github.drompincen.taskbridge.runtime.run.FatalConfigException;
import io.github.drompincen.taskbridge.runtime.run.MigrationRunner;
import io.github.drompincen.taskbridge.runtime.summary.MigrationSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the migration for the project references given as non-option arguments, or for
 * {@code taskbridge.projects} when there are none. Exit code 0 once the run completes, even with
 * failed tasks; 2 when configuration or credentials stop it before any project is processed.
 */
@Component
@ConditionalOnProperty(name = "taskbridge.run.enabled", havingValue = "true", matchIfMissing = true)
public class MigrationCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(MigrationCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FATAL = FatalConfigException.EXIT_CODE;

    private final MigrationRunner runner;
    private final ScoroSettings destination;
    private final AsanaSettings source;
    private final ImportSettings importSettings;
    private final List<String> configuredProjects;

    private int exitCode = EXIT_OK;
    private MigrationSummary lastSummary;

    public MigrationCommand(MigrationRunner runner,
                            ScoroSettings destination,
                            AsanaSettings source,
                            ImportSettings importSettings,
                            @Value("${taskbridge.projects:}") List<String> configuredProjects) {
        this.runner = runner;
        this.destination = destination;
        this.source = source;
        this.importSettings = importSettings;
        this.configuredProjects = configuredProjects;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> refs = projectRefs(args.getNonOptionArgs());
        try {
            checkConfiguration();
            lastSummary = runner.run(refs);
            exitCode = EXIT_OK;
            log.info("[Command] done: {} of {} tasks imported", lastSummary.getSucceeded(), lastSummary.getAttempted());
        } catch (FatalConfigException e) {
            log.error("[Command] {}", e.getMessage());
            exitCode = e.getExitCode();
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    MigrationSummary getLastSummary() {
        return lastSummary;
    }

    List<String> projectRefs(List<String> arguments) {
        List<String> refs = new ArrayList<>();
        List<String> candidates = arguments.isEmpty() ? configuredProjects : arguments;
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                refs.add(candidate.trim());
            }
        }
        return refs;
    }

    void checkConfiguration() {
        List<String> missing = new ArrayList<>();
        if (destination.companyAccount().isEmpty()) {
            missing.add("taskbridge.destination.company-account");
        }
        if (destination.apiKey() == null || destination.apiKey().isBlank()) {
            missing.add("taskbridge.destination.api-key");
        }
        if (!source.isComplete()) {
            missing.add("taskbridge.source.access-token");
        }
        if (importSettings.defaultUserId() <= 0) {
            missing.add("taskbridge.import.default-user-id");
        }
        if (!missing.isEmpty()) {
            throw new FatalConfigException("Missing configuration: " + String.join(", ", missing));
        }
    }
}
