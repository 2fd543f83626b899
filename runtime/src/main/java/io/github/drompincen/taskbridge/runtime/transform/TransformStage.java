package io.github.drompincen.taskbridge.runtime.transform;

import io.github.drompincen.taskbridge.protocol.api.ClassifiedProject;
import io.github.drompincen.taskbridge.protocol.api.PhaseSpec;
import io.github.drompincen.taskbridge.protocol.api.PhaseType;
import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import io.github.drompincen.taskbridge.protocol.api.TransformedProject;
import io.github.drompincen.taskbridge.protocol.api.TransformedTask;
import io.github.drompincen.taskbridge.protocol.source.SourceMilestone;
import io.github.drompincen.taskbridge.protocol.source.SourceProject;
import io.github.drompincen.taskbridge.protocol.source.SourceTask;
import io.github.drompincen.taskbridge.runtime.context.RunContext;
import io.github.drompincen.taskbridge.runtime.dedup.DedupDecision;
import io.github.drompincen.taskbridge.runtime.mapping.CategoryMapper;
import io.github.drompincen.taskbridge.runtime.mapping.CustomFields;
import io.github.drompincen.taskbridge.runtime.resolve.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns one exported project into the ordered task list the importer works through, plus
 * project metadata (company, manager, phases). Every task passes the run's dedup ledger.
 */
@Service
public class TransformStage {

    private static final Logger log = LoggerFactory.getLogger(TransformStage.class);

    private static final Pattern BLOCK_TAGS = Pattern.compile("(?i)<\\s*(br|/p|/li|/div)\\s*/?>");
    private static final Pattern TAGS = Pattern.compile("<[^>]+>");
    private static final int COMPANY_FIELD_SCAN_LIMIT = 10;

    private final TransformSettings settings;

    public TransformStage(TransformSettings settings) {
        this.settings = settings;
    }

    public TransformedProject transform(RunContext ctx, ClassifiedProject classified) {
        SourceProject project = classified.project();
        ProjectClassification classification = classified.classification();

        List<TransformedTask> tasks = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int duplicates = 0;
        int excluded = 0;

        for (SourceTask task : project.tasks()) {
            if (Names.isBlank(task.name()) || !seen.add(task.id())) {
                continue;
            }
            if (isBeforeCutoffAndIncomplete(task)) {
                ctx.summary().recordExcluded();
                excluded++;
                continue;
            }
            DedupDecision decision = ctx.ledger().reserve(task.id(), project.id(), classification);
            if (decision == DedupDecision.ALREADY_ASSIGNED_ELSEWHERE) {
                duplicates++;
                continue;
            }
            tasks.add(toTransformedTask(task));
            if (settings.maxTasksPerProject() > 0 && tasks.size() >= settings.maxTasksPerProject()) {
                log.info("[Transform] {}: task limit {} reached", project.name(), settings.maxTasksPerProject());
                break;
            }
        }

        String company = companyName(project, classification);
        String manager = managerName(project);
        log.info("[Transform] {} ({}): {} tasks kept, {} already assigned elsewhere, {} excluded by cutoff; company={}, manager={}",
                project.name(), classification, tasks.size(), duplicates, excluded, company, manager);

        return new TransformedProject(
                project.id(),
                project.name().trim(),
                stripHtml(project.notes()),
                classification,
                company,
                manager,
                project.dueOn(),
                phases(project, tasks),
                tasks);
    }

    // ---- tasks ----

    TransformedTask toTransformedTask(SourceTask task) {
        Map<String, String> fields = task.customFields();
        String category = CustomFields.find(fields, "Category", "Activity Type").orElse(null);
        String activity = CategoryMapper.map(category);
        if (!CategoryMapper.isKnown(category)) {
            log.warn("Task '{}' ({}) has category '{}', using '{}'", task.name(), task.id(),
                    category == null ? "" : category, activity);
        }

        Optional<Double> actual = CustomFields.findNumber(fields, "Actual time");
        boolean completed = task.completed() && task.completedAt() != null && actual.isPresent();
        if (task.completed() && !completed) {
            log.debug("Task {} completed at source without logged time, importing as in progress", task.id());
        }

        String owner = task.hasAssignee() ? task.assigneeNames().get(0) : task.creatorName();

        return new TransformedTask(
                task.id(),
                task.name().trim(),
                stripHtml(task.notes()),
                activity,
                Names.isBlank(task.sectionName()) ? null : task.sectionName().trim(),
                task.assigneeNames().stream().filter(n -> !Names.isBlank(n)).toList(),
                owner,
                completed,
                completed ? task.completedAt() : null,
                task.startOn(),
                task.dueOn(),
                priority(fields),
                CustomFields.findNumber(fields, "Estimated time").orElse(null),
                actual.orElse(null),
                task.comments());
    }

    private boolean isBeforeCutoffAndIncomplete(SourceTask task) {
        if (task.createdAt() == null || settings.cutoffDate() == null) {
            return false;
        }
        LocalDate created = task.createdAt().atZone(ZoneOffset.UTC).toLocalDate();
        return created.isBefore(settings.cutoffDate()) && (!task.hasAssignee() || task.dueOn() == null);
    }

    static Integer priority(Map<String, String> fields) {
        String value = CustomFields.find(fields, "Priority").orElse("").toLowerCase(Locale.ROOT);
        if (value.contains("high") || value.contains("urgent")) {
            return 1;
        }
        if (value.contains("low")) {
            return 3;
        }
        return 2;
    }

    // ---- project metadata ----

    static String companyName(SourceProject project, ProjectClassification classification) {
        if (classification == ProjectClassification.CLIENT) {
            return project.name().trim();
        }
        return project.tasks().stream()
                .limit(COMPANY_FIELD_SCAN_LIMIT)
                .map(t -> CustomFields.find(t.customFields(), "C-Name", "Company Name"))
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);
    }

    static String managerName(SourceProject project) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (SourceTask task : project.tasks()) {
            CustomFields.find(task.customFields(), "PM Name", "PM")
                    .ifPresent(pm -> counts.merge(pm, 1, Integer::sum));
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    static List<PhaseSpec> phases(SourceProject project, List<TransformedTask> tasks) {
        Map<String, LocalDate[]> sections = new LinkedHashMap<>();
        for (TransformedTask task : tasks) {
            if (task.phaseName() == null) {
                continue;
            }
            LocalDate[] range = sections.computeIfAbsent(task.phaseName(), k -> new LocalDate[2]);
            LocalDate start = task.startOn() != null ? task.startOn() : task.dueOn();
            if (start != null && (range[0] == null || start.isBefore(range[0]))) {
                range[0] = start;
            }
            if (task.dueOn() != null && (range[1] == null || task.dueOn().isAfter(range[1]))) {
                range[1] = task.dueOn();
            }
        }
        List<PhaseSpec> phases = new ArrayList<>();
        sections.forEach((title, range) -> phases.add(new PhaseSpec(title, PhaseType.PHASE,
                range[0] != null ? range[0] : project.startOn(),
                range[1] != null ? range[1] : project.dueOn())));
        for (SourceMilestone milestone : project.milestones()) {
            if (Names.isBlank(milestone.name())) {
                continue;
            }
            LocalDate start = milestone.startOn() != null ? milestone.startOn() : milestone.dueOn();
            phases.add(new PhaseSpec(milestone.name().trim(), PhaseType.MILESTONE, start, milestone.dueOn()));
        }
        return phases;
    }

    static String stripHtml(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String withBreaks = BLOCK_TAGS.matcher(text).replaceAll("\n");
        String plain = HtmlUtils.htmlUnescape(TAGS.matcher(withBreaks).replaceAll(""));
        return plain.replaceAll("\n{3,}", "\n\n").trim();
    }
}
