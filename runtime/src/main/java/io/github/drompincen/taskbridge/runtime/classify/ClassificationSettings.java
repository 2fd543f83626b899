package io.github.drompincen.taskbridge.runtime.classify;

import io.github.drompincen.taskbridge.protocol.api.ProjectClassification;

import java.util.List;
import java.util.Map;

/**
 * @param indicators      lower-case fragments that mark a personal project name
 * @param teamMemberNames people whose bare-name projects are personal
 * @param overrides       explicit classification by source project id
 */
public record ClassificationSettings(
        List<String> indicators,
        List<String> teamMemberNames,
        Map<String, ProjectClassification> overrides
) {
    public static final List<String> DEFAULT_INDICATORS = List.of(
            "'s project", "'s tasks", "'s workspace", " personal", " individual", " my ");

    public ClassificationSettings {
        indicators = indicators == null || indicators.isEmpty() ? DEFAULT_INDICATORS : List.copyOf(indicators);
        teamMemberNames = teamMemberNames == null ? List.of() : List.copyOf(teamMemberNames);
        overrides = overrides == null ? Map.of() : Map.copyOf(overrides);
    }

    public static ClassificationSettings defaults() {
        return new ClassificationSettings(DEFAULT_INDICATORS, List.of(), Map.of());
    }
}
