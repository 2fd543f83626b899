package io.github.drompincen.taskbridge.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.taskbridge.client.asana.AsanaClient;
import io.github.drompincen.taskbridge.client.asana.AsanaExporter;
import io.github.drompincen.taskbridge.client.asana.AsanaSettings;
import io.github.drompincen.taskbridge.client.http.JsonTransport;
import io.github.drompincen.taskbridge.client.notify.HttpStatusNotifier;
import io.github.drompincen.taskbridge.client.notify.MonitorSettings;
import io.github.drompincen.taskbridge.client.scoro.ScoroClient;
import io.github.drompincen.taskbridge.client.scoro.ScoroSettings;
import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import io.github.drompincen.taskbridge.runtime.classify.ClassificationSettings;
import io.github.drompincen.taskbridge.runtime.importer.ImportSettings;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import io.github.drompincen.taskbridge.runtime.remote.SourceExporter;
import io.github.drompincen.taskbridge.runtime.remote.StatusNotifier;
import io.github.drompincen.taskbridge.runtime.retry.RetryPolicy;
import io.github.drompincen.taskbridge.runtime.retry.Sleeper;
import io.github.drompincen.taskbridge.runtime.run.FatalConfigException;
import io.github.drompincen.taskbridge.runtime.transform.TransformSettings;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Binds {@code taskbridge.*} properties and wires the HTTP clients behind the runtime seams.
 * Credentials are not checked here; {@link io.github.drompincen.taskbridge.app.MigrationCommand}
 * does that before a run starts.
 */
@Configuration
public class MigrationConfig {

    // ---- runtime settings ----

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    Sleeper sleeper() {
        return Sleeper.SYSTEM;
    }

    @Bean
    RetryPolicy retryPolicy(@Value("${taskbridge.retry.max-attempts:3}") int maxAttempts,
                            @Value("${taskbridge.retry.base-delay-ms:1000}") long baseDelayMs,
                            @Value("${taskbridge.retry.multiplier:2.0}") double multiplier,
                            @Value("${taskbridge.retry.max-delay-ms:30000}") long maxDelayMs,
                            @Value("${taskbridge.retry.min-interval-ms:50}") long minIntervalMs) {
        return new RetryPolicy(maxAttempts, Duration.ofMillis(baseDelayMs), multiplier,
                Duration.ofMillis(maxDelayMs), Duration.ofMillis(minIntervalMs));
    }

    @Bean
    ClassificationSettings classificationSettings(
            @Value("${taskbridge.classification.team-member-indicators:}") List<String> indicators,
            @Value("${taskbridge.classification.team-member-names:}") List<String> teamMemberNames,
            @Value("${taskbridge.classification.overrides:}") List<String> overrides) {
        return new ClassificationSettings(indicators, teamMemberNames, parseOverrides(overrides));
    }

    @Bean
    TransformSettings transformSettings(@Value("${taskbridge.import.cutoff-date:2010-07-01}") String cutoffDate,
                                        @Value("${taskbridge.import.max-tasks-per-project:0}") int maxTasks) {
        try {
            LocalDate cutoff = cutoffDate.isBlank() ? null : LocalDate.parse(cutoffDate.trim());
            return new TransformSettings(cutoff, maxTasks);
        } catch (DateTimeParseException e) {
            throw new FatalConfigException("taskbridge.import.cutoff-date is not a yyyy-MM-dd date: " + cutoffDate, e);
        }
    }

    @Bean
    ImportSettings importSettings(@Value("${taskbridge.import.default-user-id:0}") int defaultUserId,
                                  @Value("${taskbridge.import.project-status:" + ImportSettings.DEFAULT_PROJECT_STATUS + "}")
                                  String projectStatus) {
        return new ImportSettings(defaultUserId, projectStatus);
    }

    // ---- remote endpoints ----

    @Bean
    HttpClient httpClient() {
        return JsonTransport.defaultClient();
    }

    @Bean
    JsonTransport jsonTransport(HttpClient httpClient, ObjectMapper objectMapper,
                                @Value("${taskbridge.http.request-timeout-ms:60000}") long timeoutMs) {
        return new JsonTransport(httpClient, objectMapper, Duration.ofMillis(timeoutMs));
    }

    @Bean
    ScoroSettings scoroSettings(@Value("${taskbridge.destination.company-account:}") String companyAccount,
                                @Value("${taskbridge.destination.api-key:}") String apiKey,
                                @Value("${taskbridge.destination.base-url:}") String baseUrl,
                                @Value("${taskbridge.destination.lang:eng}") String lang) {
        return new ScoroSettings(companyAccount, apiKey, baseUrl, lang);
    }

    @Bean
    AsanaSettings asanaSettings(@Value("${taskbridge.source.base-url:" + AsanaSettings.DEFAULT_BASE_URL + "}") String baseUrl,
                                @Value("${taskbridge.source.access-token:}") String accessToken,
                                @Value("${taskbridge.source.workspace-id:}") String workspaceId) {
        return new AsanaSettings(baseUrl, accessToken, workspaceId);
    }

    @Bean
    MonitorSettings monitorSettings(@Value("${taskbridge.monitor.url:}") String url,
                                    @Value("${taskbridge.monitor.timeout-ms:2000}") long timeoutMs,
                                    @Value("${taskbridge.monitor.source-id-field:asana GID}") String idField,
                                    @Value("${taskbridge.monitor.source-name-field:asana project name}") String nameField) {
        return new MonitorSettings(url, Duration.ofMillis(timeoutMs), idField, nameField);
    }

    @Bean
    DestinationApi destinationApi(JsonTransport jsonTransport, ScoroSettings scoroSettings) {
        return new ScoroClient(jsonTransport, scoroSettings);
    }

    @Bean
    SourceExporter sourceExporter(JsonTransport jsonTransport, AsanaSettings asanaSettings) {
        return new AsanaExporter(new AsanaClient(jsonTransport, asanaSettings));
    }

    @Bean
    StatusNotifier statusNotifier(HttpClient httpClient, ObjectMapper objectMapper, MonitorSettings monitorSettings) {
        if (!monitorSettings.isEnabled()) {
            return StatusNotifier.NO_OP;
        }
        JsonTransport transport = new JsonTransport(httpClient, objectMapper, monitorSettings.timeout());
        return new HttpStatusNotifier(transport, monitorSettings);
    }

    /** Entries look like {@code 1203344=CLIENT}. */
    static Map<String, ProjectClassification> parseOverrides(List<String> entries) {
        Map<String, ProjectClassification> overrides = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry == null || entry.isBlank()) {
                continue;
            }
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new FatalConfigException("Bad classification override '" + entry + "', expected <projectId>=CLIENT|TEAM_MEMBER");
            }
            String value = entry.substring(eq + 1).trim().toUpperCase(Locale.ROOT).replace('-', '_');
            try {
                overrides.put(entry.substring(0, eq).trim(), ProjectClassification.valueOf(value));
            } catch (IllegalArgumentException e) {
                throw new FatalConfigException("Bad classification in override '" + entry + "'", e);
            }
        }
        return overrides;
    }
}
