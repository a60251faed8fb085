package com.pickalert.domain.service;

/**
 * A global pick index falls outside the draft described by its settings.
 */
public class PickOutOfRangeException extends IllegalArgumentException {

    private final int globalIndex;
    private final int totalPicks;

    public PickOutOfRangeException(int globalIndex, int totalPicks) {
        super("Pick index " + globalIndex + " is outside [1, " + totalPicks + "]");
        this.globalIndex = globalIndex;
        this.totalPicks = totalPicks;
    }

    public int getGlobalIndex() {
        return globalIndex;
    }

    public int getTotalPicks() {
        return totalPicks;
    }
}
