package io.github.drompincen.taskbridge.protocol.remote;

public record RemoteCompany(
        int id,
        String name
) {}
