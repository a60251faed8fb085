package com.pickalert.application.monitor;

/**
 * Result of one {@link DraftMonitor} cycle.
 *
 * <p>Success cases:</p>
 * <ul>
 *   <li>{@link Advanced}: new picks were announced and the stored count moved forward</li>
 *   <li>{@link NoChange}: the feed had nothing new</li>
 *   <li>{@link NotRegistered}: the draft is not monitored, nothing was done</li>
 * </ul>
 *
 * <p>Failure cases leave the stored count untouched:</p>
 * <ul>
 *   <li>{@link TransientFailure}: feed or store unreachable, the next tick retries</li>
 *   <li>{@link DataIntegrityFailure}: the feed regressed, skipped or contradicted the settings; needs an operator</li>
 *   <li>{@link DeliveryFailure}: a notification was not accepted, the whole batch is retried next tick</li>
 * </ul>
 */
public sealed interface CycleOutcome permits
    CycleOutcome.Advanced,
    CycleOutcome.NoChange,
    CycleOutcome.NotRegistered,
    CycleOutcome.TransientFailure,
    CycleOutcome.DataIntegrityFailure,
    CycleOutcome.DeliveryFailure {

    String draftId();

    /**
     * One-line description for logs and API responses.
     */
    String describe();

    default boolean isFailure() {
        return this instanceof TransientFailure
            || this instanceof DataIntegrityFailure
            || this instanceof DeliveryFailure;
    }

    record Advanced(String draftId, int previousCount, int newCount) implements CycleOutcome {

        public Advanced {
            if (newCount <= previousCount) {
                throw new IllegalArgumentException(
                    "newCount must exceed previousCount (" + newCount + " <= " + previousCount + ")");
            }
        }

        public int notificationsSent() {
            return newCount - previousCount;
        }

        @Override
        public String describe() {
            return "announced picks " + (previousCount + 1) + ".." + newCount;
        }
    }

    record NoChange(String draftId, int pickCount) implements CycleOutcome {

        @Override
        public String describe() {
            return "no new picks (" + pickCount + " known)";
        }
    }

    record NotRegistered(String draftId) implements CycleOutcome {

        @Override
        public String describe() {
            return "draft is not registered";
        }
    }

    record TransientFailure(String draftId, CyclePhase phase, String reason) implements CycleOutcome {

        @Override
        public String describe() {
            return "transient failure while " + phase + ": " + reason;
        }
    }

    record DataIntegrityFailure(String draftId, int lastKnownPickCount, String reason) implements CycleOutcome {

        @Override
        public String describe() {
            return "feed integrity violation at last known count " + lastKnownPickCount + ": " + reason;
        }
    }

    record DeliveryFailure(String draftId, int failedPickIndex, int deliveredBeforeFailure, String reason)
        implements CycleOutcome {

        @Override
        public String describe() {
            return "delivery of pick " + failedPickIndex + " failed after " + deliveredBeforeFailure
                + " delivered: " + reason;
        }
    }
}
