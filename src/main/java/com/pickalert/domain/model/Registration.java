package com.pickalert.domain.model;

import java.util.Objects;

/**
 * Binds a draft to the channel its alerts go to, along with how many picks have already been announced.
 */
public record Registration(String draftId, String channelId, int lastKnownPickCount) {

    public Registration {
        Objects.requireNonNull(draftId, "draftId");
        Objects.requireNonNull(channelId, "channelId");
        if (lastKnownPickCount < 0) {
            throw new IllegalArgumentException("lastKnownPickCount must be >= 0, got " + lastKnownPickCount);
        }
    }
}
