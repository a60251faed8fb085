package com.pickalert.domain.model;

import java.util.Map;
import java.util.Optional;

/**
 * Shape of a draft: how many teams pick, for how many rounds, and in which order.
 *
 * @param teamCount     number of teams picking each round
 * @param totalRounds   number of rounds in the draft
 * @param reversalRound round at which the snake direction flips once more, or null for none
 * @param draftType     snake or linear ordering
 * @param status        lifecycle status reported by the host
 * @param slotOwners    1-based draft slot to external user id; empty until the order is set
 */
public record DraftSettings(
    int teamCount,
    int totalRounds,
    Integer reversalRound,
    DraftType draftType,
    DraftStatus status,
    Map<Integer, String> slotOwners
) {

    public DraftSettings {
        if (teamCount <= 0) {
            throw new IllegalArgumentException("teamCount must be positive, got " + teamCount);
        }
        if (totalRounds <= 0) {
            throw new IllegalArgumentException("totalRounds must be positive, got " + totalRounds);
        }
        if (reversalRound != null && reversalRound <= 0) {
            throw new IllegalArgumentException("reversalRound must be positive when present, got " + reversalRound);
        }
        draftType = draftType != null ? draftType : DraftType.SNAKE;
        status = status != null ? status : DraftStatus.UNKNOWN;
        slotOwners = slotOwners != null ? Map.copyOf(slotOwners) : Map.of();
    }

    /**
     * Snake settings with no known slot owners.
     */
    public static DraftSettings snake(int teamCount, int totalRounds, Integer reversalRound) {
        return new DraftSettings(teamCount, totalRounds, reversalRound, DraftType.SNAKE, DraftStatus.DRAFTING, Map.of());
    }

    public int totalPicks() {
        return teamCount * totalRounds;
    }

    public Optional<Integer> reversal() {
        return Optional.ofNullable(reversalRound);
    }

    public Optional<String> ownerOfSlot(int slot) {
        return Optional.ofNullable(slotOwners.get(slot));
    }
}
