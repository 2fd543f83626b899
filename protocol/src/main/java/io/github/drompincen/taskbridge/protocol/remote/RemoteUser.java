package io.github.drompincen.taskbridge.protocol.remote;

public record RemoteUser(
        int id,
        String firstName,
        String lastName,
        String fullName,
        String email,
        boolean active,
        String status
) {
    public String firstLast() {
        String first = firstName == null ? "" : firstName.trim();
        String last = lastName == null ? "" : lastName.trim();
        return (first + " " + last).trim();
    }
}
