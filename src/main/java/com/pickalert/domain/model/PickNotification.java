package com.pickalert.domain.model;

/**
 * Transport-neutral content of one pick alert.
 */
public record PickNotification(
    String summary,
    int pickNumber,
    int round,
    int slotInRound,
    String playerName,
    String position,
    String nflTeam,
    String pickedByLabel,
    OnTheClock onTheClock
) {
}
