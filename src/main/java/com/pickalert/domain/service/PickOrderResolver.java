package com.pickalert.domain.service;

import com.pickalert.domain.model.DraftSettings;
import com.pickalert.domain.model.DraftType;
import com.pickalert.domain.model.NextPickProjection;
import com.pickalert.domain.model.Pick;
import com.pickalert.domain.model.PickSlot;
import com.pickalert.domain.model.ResolvedPick;

/**
 * Maps global pick indexes to rounds, slots and teams.
 *
 * <p>Snake drafts alternate direction every round: odd rounds run from slot 1 to slot N,
 * even rounds from N back to 1. A reversal round (e.g. "3rd Round Reversal") inverts the
 * direction once more from that round onward, after which alternation continues normally.
 * With 10 teams and a reversal at round 3 the directions are F, B, B, F, B, F, ...</p>
 *
 * <p>Linear drafts run forward every round and ignore the reversal round.</p>
 */
public final class PickOrderResolver {

    private PickOrderResolver() {
    }

    /**
     * Resolves where a global pick index lands in the draft order.
     *
     * @param settings Draft shape
     * @param globalIndex 1-based pick index across the whole draft
     * @return round, slot in round, picking team and direction
     * @throws PickOutOfRangeException if the index is below 1 or past the last pick
     */
    public static PickSlot resolve(DraftSettings settings, int globalIndex) {
        int teamCount = settings.teamCount();
        if (globalIndex < 1 || globalIndex > settings.totalPicks()) {
            throw new PickOutOfRangeException(globalIndex, settings.totalPicks());
        }

        int round = (globalIndex + teamCount - 1) / teamCount;
        int slotInRound = globalIndex - (round - 1) * teamCount;
        boolean reversed = isReversed(settings, round);
        int teamIndex = reversed ? teamCount - slotInRound + 1 : slotInRound;

        return new PickSlot(globalIndex, round, slotInRound, teamIndex, reversed);
    }

    /**
     * Resolves an observed pick.
     */
    public static ResolvedPick resolve(DraftSettings settings, Pick pick) {
        return new ResolvedPick(pick, resolve(settings, pick.globalIndex()));
    }

    /**
     * Whether a round runs from the last slot to the first.
     */
    public static boolean isReversed(DraftSettings settings, int round) {
        if (settings.draftType() != DraftType.SNAKE) {
            return false;
        }
        boolean normallyReversed = round % 2 == 0;
        boolean pastReversal = settings.reversalRound() != null && round >= settings.reversalRound();
        return normallyReversed ^ pastReversal;
    }

    /**
     * Projects who picks after {@code picksMade} picks have been made.
     *
     * @return "draft complete" once every pick is made, otherwise the next slot and its owner if known
     */
    public static NextPickProjection projectNext(DraftSettings settings, int picksMade) {
        int nextIndex = picksMade + 1;
        if (nextIndex > settings.totalPicks()) {
            return NextPickProjection.complete();
        }
        PickSlot slot = resolve(settings, nextIndex);
        return NextPickProjection.next(slot, settings.ownerOfSlot(slot.teamIndex()).orElse(null));
    }
}
