package com.pickalert.domain.model;

import java.util.Optional;

/**
 * Who is on the clock after a pick: either the next slot in the order or the end of the draft.
 */
public record NextPickProjection(boolean draftComplete, PickSlot slot, String ownerId) {

    public static NextPickProjection complete() {
        return new NextPickProjection(true, null, null);
    }

    public static NextPickProjection next(PickSlot slot, String ownerId) {
        return new NextPickProjection(false, slot, ownerId);
    }

    public Optional<String> owner() {
        return Optional.ofNullable(ownerId);
    }
}
