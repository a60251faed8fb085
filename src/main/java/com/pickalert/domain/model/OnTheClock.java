package com.pickalert.domain.model;

/**
 * The "on the clock" line of a pick notification.
 */
public record OnTheClock(Kind kind, String label) {

    public static final String DRAFT_COMPLETE_LABEL = "The draft is complete!";

    public enum Kind {
        /** A team is projected to pick next. */
        PROJECTED,
        /** No picks remain. */
        DRAFT_COMPLETE,
        /** No projection for this pick, a later pick in the same batch follows it. */
        NONE
    }

    public static OnTheClock projected(String label) {
        return new OnTheClock(Kind.PROJECTED, label);
    }

    public static OnTheClock draftComplete() {
        return new OnTheClock(Kind.DRAFT_COMPLETE, DRAFT_COMPLETE_LABEL);
    }

    public static OnTheClock none() {
        return new OnTheClock(Kind.NONE, null);
    }

    public boolean isPresent() {
        return kind != Kind.NONE;
    }
}
