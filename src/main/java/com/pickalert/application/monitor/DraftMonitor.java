package com.pickalert.application.monitor;

import com.pickalert.domain.model.DraftSettings;
import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.model.NextPickProjection;
import com.pickalert.domain.model.Pick;
import com.pickalert.domain.model.PickNotification;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.model.ResolvedPick;
import com.pickalert.domain.ports.DraftFeedClient;
import com.pickalert.domain.ports.DraftFeedException;
import com.pickalert.domain.ports.NotificationDeliveryException;
import com.pickalert.domain.ports.Notifier;
import com.pickalert.domain.ports.RegistrationStore;
import com.pickalert.domain.ports.RegistrationStoreException;
import com.pickalert.domain.service.PickOrderResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs one reconciliation cycle for a draft: load the registration, fetch the feed,
 * validate it against what was already announced, send one alert per new pick in order,
 * then store the new pick count.
 *
 * <p>The count is stored only after every alert of the cycle was accepted. A crash between
 * sending and storing re-sends the same alerts on the next cycle; a failed cycle never
 * skips a pick.</p>
 *
 * <p>No locking is done here. Callers must not run two cycles for the same draft at once.</p>
 */
@Service
public class DraftMonitor {

    private static final Logger logger = LoggerFactory.getLogger(DraftMonitor.class);

    private final DraftFeedClient draftFeedClient;
    private final RegistrationStore registrationStore;
    private final Notifier notifier;
    private final NotificationComposer notificationComposer;

    public DraftMonitor(
            DraftFeedClient draftFeedClient,
            RegistrationStore registrationStore,
            Notifier notifier,
            NotificationComposer notificationComposer) {
        this.draftFeedClient = draftFeedClient;
        this.registrationStore = registrationStore;
        this.notifier = notifier;
        this.notificationComposer = notificationComposer;
    }

    /**
     * Runs one cycle for a draft. Never throws for feed, store or delivery problems;
     * those are reported through the returned outcome.
     *
     * @param draftId The draft to reconcile
     * @return What the cycle did
     */
    public CycleOutcome runCycle(String draftId) {
        Optional<Registration> found;
        try {
            found = registrationStore.find(draftId);
        } catch (RegistrationStoreException e) {
            logger.warn("Could not load registration for draft {}", draftId, e);
            return new CycleOutcome.TransientFailure(draftId, CyclePhase.LOADING, e.getMessage());
        }
        if (found.isEmpty()) {
            logger.debug("Draft {} is not registered, skipping", draftId);
            return new CycleOutcome.NotRegistered(draftId);
        }

        Registration registration = found.get();
        int lastKnownPickCount = registration.lastKnownPickCount();

        DraftSnapshot snapshot;
        try {
            snapshot = draftFeedClient.fetch(draftId);
        } catch (DraftFeedException e) {
            if (e.getReason() == DraftFeedException.Reason.MALFORMED) {
                logger.error("Draft {} feed is malformed: {}", draftId, e.getMessage());
                return new CycleOutcome.DataIntegrityFailure(draftId, lastKnownPickCount, e.getMessage());
            }
            logger.warn("Draft {} feed could not be fetched ({}): {}", draftId, e.getReason(), e.getMessage());
            return new CycleOutcome.TransientFailure(draftId, CyclePhase.FETCHING, e.getMessage());
        }

        List<Pick> picks = snapshot.picks();
        Optional<String> violation = findIntegrityViolation(snapshot, lastKnownPickCount);
        if (violation.isPresent()) {
            logger.error("Draft {} failed integrity check at last known count {}: {}",
                draftId, lastKnownPickCount, violation.get());
            return new CycleOutcome.DataIntegrityFailure(draftId, lastKnownPickCount, violation.get());
        }

        int currentPickCount = picks.size();
        if (currentPickCount == lastKnownPickCount) {
            return new CycleOutcome.NoChange(draftId, currentPickCount);
        }

        logger.info("New picks detected in draft {}: count changed from {} to {}",
            draftId, lastKnownPickCount, currentPickCount);

        DraftSettings settings = snapshot.settings();
        List<Pick> newPicks = picks.subList(lastKnownPickCount, currentPickCount);
        int delivered = 0;
        for (Pick pick : newPicks) {
            ResolvedPick resolved = PickOrderResolver.resolve(settings, pick);
            if (resolved.round() != resolved.slot().round()) {
                logger.warn("Draft {} pick {} reports round {} but the order puts it in round {}",
                    draftId, pick.globalIndex(), resolved.round(), resolved.slot().round());
            }

            NextPickProjection projection = pick.globalIndex() == currentPickCount
                ? PickOrderResolver.projectNext(settings, currentPickCount)
                : null;
            PickNotification notification = notificationComposer.compose(resolved, projection, true);

            try {
                notifier.send(registration.channelId(), notification);
                delivered++;
            } catch (NotificationDeliveryException e) {
                logger.error("Failed to deliver pick {} of draft {} to channel {} ({} delivered this cycle)",
                    pick.globalIndex(), draftId, registration.channelId(), delivered, e);
                return new CycleOutcome.DeliveryFailure(draftId, pick.globalIndex(), delivered, e.getMessage());
            }
        }

        try {
            registrationStore.setLastKnownCount(draftId, currentPickCount);
        } catch (RegistrationStoreException e) {
            logger.warn("Alerts for draft {} were sent but the new count {} could not be stored; "
                + "they will be sent again next cycle", draftId, currentPickCount, e);
            return new CycleOutcome.TransientFailure(draftId, CyclePhase.PERSISTING, e.getMessage());
        }

        logger.info("Draft {} advanced to {} picks ({} alerts sent)", draftId, currentPickCount, delivered);
        return new CycleOutcome.Advanced(draftId, lastKnownPickCount, currentPickCount);
    }

    /**
     * Checks that the feed only grew since the last cycle and that its indexes run 1, 2, 3, ...
     * without gaps and within the draft's total number of picks.
     *
     * @return description of the first problem found, or empty if the feed is consistent
     */
    public static Optional<String> findIntegrityViolation(DraftSnapshot snapshot, int lastKnownPickCount) {
        List<Pick> picks = snapshot.picks();
        if (picks.size() < lastKnownPickCount) {
            return Optional.of("feed regressed from " + lastKnownPickCount + " to " + picks.size() + " picks");
        }
        for (int i = 0; i < picks.size(); i++) {
            int expected = i + 1;
            int actual = picks.get(i).globalIndex();
            if (actual != expected) {
                return Optional.of("expected pick index " + expected + " at position " + i + " but found " + actual);
            }
        }
        int totalPicks = snapshot.settings().totalPicks();
        if (picks.size() > totalPicks) {
            return Optional.of("feed has " + picks.size() + " picks but the draft only has " + totalPicks);
        }
        return Optional.empty();
    }
}
