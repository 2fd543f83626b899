package io.github.drompincen.taskbridge.app;

import io.github.drompincen.taskbridge.client.asana.AsanaSettings;
import io.github.drompincen.taskbridge.client.scoro.ScoroSettings;
import io.github.drompincen.taskbridge.runtime.importer.ImportSettings;
import io.github.drompincen.taskbridge.runtime.run.FatalConfigException;
import io.github.drompincen.taskbridge.runtime.run.MigrationRunner;
import io.github.drompincen.taskbridge.runtime.summary.MigrationSummary;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MigrationCommandTest {

    private static final ScoroSettings DESTINATION = new ScoroSettings("acme", "key", null, null);
    private static final AsanaSettings SOURCE = new AsanaSettings(null, "token", "ws1");
    private static final ImportSettings IMPORT = new ImportSettings(99, ImportSettings.DEFAULT_PROJECT_STATUS);

    @Mock
    private MigrationRunner runner;

    @Test
    void argumentsTakePrecedenceOverConfiguredProjects() {
        when(runner.run(any())).thenReturn(new MigrationSummary(Instant.now()));
        MigrationCommand command = new MigrationCommand(runner, DESTINATION, SOURCE, IMPORT, List.of("111"));

        command.run(new DefaultApplicationArguments("222", "Website Redesign", "--verbose"));

        verify(runner).run(List.of("222", "Website Redesign"));
        assertThat(command.getExitCode()).isEqualTo(MigrationCommand.EXIT_OK);
    }

    @Test
    void configuredProjectsUsedWithoutArguments() {
        when(runner.run(any())).thenReturn(new MigrationSummary(Instant.now()));
        MigrationCommand command = new MigrationCommand(runner, DESTINATION, SOURCE, IMPORT, List.of(" 111 ", ""));

        command.run(new DefaultApplicationArguments());

        verify(runner).run(List.of("111"));
        assertThat(command.getLastSummary()).isNotNull();
    }

    @Test
    void missingCredentialsExitWithoutRunning() {
        ScoroSettings noKey = new ScoroSettings("acme", "", null, null);
        ImportSettings noDefaultUser = new ImportSettings(0, ImportSettings.DEFAULT_PROJECT_STATUS);
        MigrationCommand command = new MigrationCommand(runner, noKey, SOURCE, noDefaultUser, List.of("111"));

        command.run(new DefaultApplicationArguments());

        verify(runner, never()).run(any());
        assertThat(command.getExitCode()).isEqualTo(MigrationCommand.EXIT_FATAL);
    }

    @Test
    void fatalPreflightExitsWithTwo() {
        when(runner.run(any())).thenThrow(new FatalConfigException("Preflight failed, credentials were refused"));
        MigrationCommand command = new MigrationCommand(runner, DESTINATION, SOURCE, IMPORT, List.of());

        command.run(new DefaultApplicationArguments("111"));

        assertThat(command.getExitCode()).isEqualTo(MigrationCommand.EXIT_FATAL);
    }
}
