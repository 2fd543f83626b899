package io.github.drompincen.taskbridge.runtime.classify;

import io.github.drompincen.taskbridge.protocol.api.ClassifiedProject;
import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;
import io.github.drompincen.taskbridge.protocol.source.SourceProject;
import io.github.drompincen.taskbridge.runtime.resolve.Names;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Best-effort guess whether a project is a client project or one person's task list,
 * based on its display name. Explicit overrides by project id take precedence.
 */
@Component
public class ProjectClassifier {

    private static final Logger log = LoggerFactory.getLogger(ProjectClassifier.class);

    private final ClassificationSettings settings;

    public ProjectClassifier(ClassificationSettings settings) {
        this.settings = settings;
    }

    public ClassifiedProject classify(SourceProject project) {
        ProjectClassification override = settings.overrides().get(project.id());
        if (override != null) {
            log.info("Project '{}' classified {} by override", project.name(), override);
            return new ClassifiedProject(project, override);
        }
        ProjectClassification classification = classify(project.name());
        log.info("Project '{}' classified {}", project.name(), classification);
        return new ClassifiedProject(project, classification);
    }

    public ProjectClassification classify(String projectName) {
        if (Names.isBlank(projectName)) {
            return ProjectClassification.TEAM_MEMBER;
        }
        String name = Names.normalize(projectName.replace('’', '\''));
        String padded = " " + name + " ";
        for (String indicator : settings.indicators()) {
            if (padded.contains(indicator.toLowerCase(Locale.ROOT))) {
                return ProjectClassification.TEAM_MEMBER;
            }
        }
        for (String member : settings.teamMemberNames()) {
            if (matchesMember(name, Names.normalize(member))) {
                return ProjectClassification.TEAM_MEMBER;
            }
        }
        return ProjectClassification.CLIENT;
    }

    private static boolean matchesMember(String name, String member) {
        if (member.isEmpty()) {
            return false;
        }
        if (name.equals(member) || name.startsWith(member + "'s")) {
            return true;
        }
        String first = member.split(" ")[0];
        boolean startsWithFirst = name.startsWith(first + " ") || name.startsWith(first + "'s");
        return startsWithFirst && (name.contains("'s") || name.contains(" project"));
    }
}
