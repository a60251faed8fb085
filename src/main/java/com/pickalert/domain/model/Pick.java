package com.pickalert.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One observed pick from a draft feed.
 *
 * @param globalIndex 1-based position of the pick across the whole draft
 * @param round       round reported by the feed
 * @param pickedBy    external user id of the picker
 * @param draftSlot   draft slot reported by the feed, or null
 * @param player      the athlete taken
 * @param timestamp   when the pick was observed
 */
public record Pick(
    int globalIndex,
    int round,
    String pickedBy,
    Integer draftSlot,
    PlayerDescriptor player,
    Instant timestamp
) {

    public Pick {
        if (globalIndex < 1) {
            throw new IllegalArgumentException("globalIndex must be >= 1, got " + globalIndex);
        }
        if (round < 1) {
            throw new IllegalArgumentException("round must be >= 1, got " + round);
        }
        if (pickedBy == null || pickedBy.isBlank()) {
            throw new IllegalArgumentException("pickedBy is required for pick " + globalIndex);
        }
        Objects.requireNonNull(player, "player");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
