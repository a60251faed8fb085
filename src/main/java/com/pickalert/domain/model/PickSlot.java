package com.pickalert.domain.model;

/**
 * Where a global pick index lands in the draft order.
 *
 * @param globalIndex 1-based index across the draft
 * @param round       1-based round
 * @param slotInRound 1-based position within the round
 * @param teamIndex   1-based draft slot of the team making the pick
 * @param reversed    whether the round runs from the last slot to the first
 */
public record PickSlot(int globalIndex, int round, int slotInRound, int teamIndex, boolean reversed) {
}
