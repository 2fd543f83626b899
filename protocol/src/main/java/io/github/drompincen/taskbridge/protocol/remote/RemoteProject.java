package io.github.drompincen.taskbridge.protocol.remote;

public record RemoteProject(
        int id,
        String name,
        Integer companyId
) {}
