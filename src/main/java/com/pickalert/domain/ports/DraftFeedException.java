package com.pickalert.domain.ports;

/**
 * Raised by a {@link DraftFeedClient} when a draft cannot be read.
 */
public class DraftFeedException extends Exception {

    public enum Reason {
        NOT_FOUND,
        UNAVAILABLE,
        MALFORMED
    }

    private final Reason reason;

    public DraftFeedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public DraftFeedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static DraftFeedException notFound(String draftId) {
        return new DraftFeedException(Reason.NOT_FOUND, "Draft " + draftId + " was not found");
    }

    /**
     * The id cannot name a draft on the host, so it was never requested.
     */
    public static DraftFeedException invalidId(String draftId) {
        return new DraftFeedException(Reason.NOT_FOUND, "'" + draftId + "' is not a valid draft id");
    }

    public static DraftFeedException unavailable(String draftId, Throwable cause) {
        return new DraftFeedException(Reason.UNAVAILABLE,
            "Draft feed unavailable for " + draftId + ": " + cause.getMessage(), cause);
    }

    public static DraftFeedException malformed(String draftId, String detail) {
        return new DraftFeedException(Reason.MALFORMED, "Malformed feed for draft " + draftId + ": " + detail);
    }

    public Reason getReason() {
        return reason;
    }
}
