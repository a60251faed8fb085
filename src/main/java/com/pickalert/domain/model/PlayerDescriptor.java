package com.pickalert.domain.model;

/**
 * The athlete taken with a pick.
 */
public record PlayerDescriptor(
    String playerId,
    String firstName,
    String lastName,
    String position,
    String team
) {

    public static final String NOT_AVAILABLE = "N/A";

    public PlayerDescriptor {
        firstName = firstName != null ? firstName : "";
        lastName = lastName != null ? lastName : "";
        position = position == null || position.isBlank() ? NOT_AVAILABLE : position;
        team = team == null || team.isBlank() ? NOT_AVAILABLE : team;
    }

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }
}
