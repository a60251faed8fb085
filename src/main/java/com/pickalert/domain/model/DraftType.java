package com.pickalert.domain.model;

/**
 * Pick order styles reported by the draft host.
 * Anything the host reports that is not a snake draft runs forward every round.
 */
public enum DraftType {
    SNAKE("snake"),
    LINEAR("linear");

    private final String sourceKey;

    DraftType(String sourceKey) {
        this.sourceKey = sourceKey;
    }

    public String getSourceKey() {
        return sourceKey;
    }

    /**
     * Maps the host's draft type string. Unknown or missing values are treated as linear.
     */
    public static DraftType fromSourceKey(String value) {
        if (value != null && SNAKE.sourceKey.equalsIgnoreCase(value.trim())) {
            return SNAKE;
        }
        return LINEAR;
    }

    @Override
    public String toString() {
        return sourceKey;
    }
}
