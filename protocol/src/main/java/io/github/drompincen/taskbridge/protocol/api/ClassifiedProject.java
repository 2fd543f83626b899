package io.github.drompincen.taskbridge.protocol.api;

import io.github.drompincen.taskbridge.protocol.source.SourceProject;

public record ClassifiedProject(
        SourceProject project,
        ProjectClassification classification
) {
    public boolean isClient() {
        return classification == ProjectClassification.CLIENT;
    }
}
