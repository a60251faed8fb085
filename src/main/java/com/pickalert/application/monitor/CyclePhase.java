package com.pickalert.application.monitor;

/**
 * Steps of one reconciliation cycle, in execution order.
 */
public enum CyclePhase {
    LOADING,
    FETCHING,
    DIFFING,
    NOTIFYING,
    PERSISTING
}
