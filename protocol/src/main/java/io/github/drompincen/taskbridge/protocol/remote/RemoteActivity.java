package io.github.drompincen.taskbridge.protocol.remote;

public record RemoteActivity(
        int id,
        String name
) {}
