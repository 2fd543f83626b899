package io.github.drompincen.taskbridge.runtime.run;

import io.github.drompincen.taskbridge.protocol.api.ClassifiedProject;
import io.github.drompincen.taskbridge.protocol.api.FailureStage;
import io.github.drompincen.taskbridge.protocol.api.ImportFailure;
import io.github.drompincen.taskbridge.protocol.api.ImportState;
import io.github.drompincen.taskbridge.protocol.api.MigrationStatus;
import io.github.drompincen.taskbridge.protocol.api.ProjectOutcome;
import io.github.drompincen.taskbridge.protocol.api.TransformedProject;
import io.github.drompincen.taskbridge.protocol.source.SourceProject;
import io.github.drompincen.taskbridge.runtime.classify.ProjectClassifier;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.dedup.DedupLedger;
import io.github.drompincen.taskbridge.runtime.importer.ImportOrchestrator;
import io.github.drompincen.taskbridge.runtime.remote.DestinationApi;
import io.github.drompincen.taskbridge.runtime.remote.RemoteApiException;
import io.github.drompincen.taskbridge.runtime.remote.SourceExporter;
import io.github.drompincen.taskbridge.runtime.remote.StatusNotifier;
import io.github.drompincen.taskbridge.runtime.retry.RetryPolicy;
import io.github.drompincen.taskbridge.runtime.retry.Sleeper;
import io.github.drompincen.taskbridge.runtime.summary.MigrationSummary;
import io.github.drompincen.taskbridge.runtime.transform.TransformStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs a whole migration: preflight, export and classify every requested project, then
 * transform and import them client projects first. Returns the summary; only a
 * {@link FatalConfigException} from the preflight escapes.
 */
@Service
public class MigrationRunner {

    private static final Logger log = LoggerFactory.getLogger(MigrationRunner.class);

    private final SourceExporter exporter;
    private final DestinationApi destination;
    private final StatusNotifier notifier;
    private final ProjectClassifier classifier;
    private final TransformStage transformStage;
    private final ImportOrchestrator orchestrator;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Sleeper sleeper;

    public MigrationRunner(SourceExporter exporter,
                           DestinationApi destination,
                           StatusNotifier notifier,
                           ProjectClassifier classifier,
                           TransformStage transformStage,
                           ImportOrchestrator orchestrator,
                           RetryPolicy retryPolicy,
                           Clock clock,
                           Sleeper sleeper) {
        this.exporter = exporter;
        this.destination = destination;
        this.notifier = notifier;
        this.classifier = classifier;
        this.transformStage = transformStage;
        this.orchestrator = orchestrator;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public MigrationSummary run(List<String> projectRefs) {
        if (projectRefs == null || projectRefs.isEmpty()) {
            throw new FatalConfigException("No source projects requested");
        }
        RunContext ctx = RunContext.start(retryPolicy, clock, sleeper);
        log.info("[Run] {} starting with {} projects", ctx.runId(), projectRefs.size());
        preflight(ctx);

        List<ClassifiedProject> exported = exportAll(ctx, projectRefs);
        List<ClassifiedProject> ordered = DedupLedger.priorityOrder(exported);

        List<TransformedProject> transformed = new ArrayList<>();
        for (ClassifiedProject project : ordered) {
            SourceProject source = project.project();
            try {
                transformed.add(transformStage.transform(ctx, project));
                notifyStatus(source.id(), source.name(), MigrationStatus.PHASE2);
            } catch (RuntimeException e) {
                log.error("[Run] transform of '{}' failed", source.name(), e);
                ctx.summary().recordProjectFailure(ImportFailure.project(source.id(), source.name(),
                        FailureStage.TRANSFORM, e.getMessage()));
            }
        }

        for (TransformedProject project : transformed) {
            ProjectOutcome outcome = orchestrator.importProject(ctx, project);
            if (outcome.finalState() == ImportState.DONE) {
                notifyStatus(project.sourceId(), project.name(), MigrationStatus.PHASE3);
            }
        }

        MigrationSummary summary = ctx.finish();
        log.info("[Run] {} finished\n{}", ctx.runId(), summary.report());
        return summary;
    }

    private void preflight(RunContext ctx) {
        try {
            ctx.executor().run("destination access check", destination::verifyAccess);
            ctx.executor().run("source access check", exporter::verifyAccess);
        } catch (RemoteApiException e) {
            String reason = e.isAuthFailure() ? "credentials were refused" : "service is unreachable";
            throw new FatalConfigException("Preflight failed, " + reason + ": " + e.getMessage(), e);
        }
    }

    private List<ClassifiedProject> exportAll(RunContext ctx, List<String> projectRefs) {
        List<ClassifiedProject> exported = new ArrayList<>();
        for (String ref : projectRefs) {
            try {
                SourceProject project = exporter.exportProject(ref, ctx.executor());
                log.info("[Run] exported '{}' ({} tasks, {} milestones)",
                        project.name(), project.tasks().size(), project.milestones().size());
                exported.add(classifier.classify(project));
                notifyStatus(project.id(), project.name(), MigrationStatus.PHASE1);
            } catch (RemoteApiException e) {
                log.error("[Run] export of '{}' failed", ref, e);
                ctx.summary().recordProjectFailure(ImportFailure.project(ref, ref, FailureStage.EXPORT, e.getMessage()));
            }
        }
        return exported;
    }

    private void notifyStatus(String projectId, String projectName, MigrationStatus status) {
        try {
            notifier.notify(projectId, projectName, status);
        } catch (RuntimeException e) {
            log.warn("[Run] status notification {} for '{}' failed: {}", status.label(), projectName, e.getMessage());
        }
    }
}
