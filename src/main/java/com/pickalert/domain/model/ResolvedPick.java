package com.pickalert.domain.model;

/**
 * A pick together with its computed place in the draft order. Never persisted.
 */
public record ResolvedPick(Pick pick, PickSlot slot) {

    public int globalIndex() {
        return pick.globalIndex();
    }

    public int round() {
        return pick.round();
    }

    public int slotInRound() {
        return slot.slotInRound();
    }

    public int teamIndex() {
        return slot.teamIndex();
    }

    public boolean isReversed() {
        return slot.reversed();
    }
}
