package com.pickalert.domain.model;

/**
 * Lifecycle status of a draft as reported by the draft host.
 */
public enum DraftStatus {
    PRE_DRAFT("pre_draft"),
    DRAFTING("drafting"),
    PAUSED("paused"),
    COMPLETE("complete"),
    UNKNOWN("unknown");

    private final String sourceKey;

    DraftStatus(String sourceKey) {
        this.sourceKey = sourceKey;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    public static DraftStatus fromSourceKey(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (DraftStatus status : values()) {
            if (status.sourceKey.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return sourceKey;
    }
}
