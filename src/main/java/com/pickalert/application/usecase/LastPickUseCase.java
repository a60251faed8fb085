package com.pickalert.application.usecase;

import com.pickalert.application.monitor.DraftMonitor;
import com.pickalert.application.monitor.NotificationComposer;
import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.model.DraftStatus;
import com.pickalert.domain.model.Pick;
import com.pickalert.domain.model.PickNotification;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.ports.DraftFeedClient;
import com.pickalert.domain.ports.DraftFeedException;
import com.pickalert.domain.ports.RegistrationStore;
import com.pickalert.domain.service.PickOrderResolver;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Use case for showing the most recent pick of the draft bound to a channel.
 * Unlike monitor alerts, the next picker is named but not mentioned.
 */
@Service
public class LastPickUseCase {

    private final DraftFeedClient draftFeedClient;
    private final RegistrationStore registrationStore;
    private final NotificationComposer notificationComposer;

    public LastPickUseCase(
            DraftFeedClient draftFeedClient,
            RegistrationStore registrationStore,
            NotificationComposer notificationComposer) {
        this.draftFeedClient = draftFeedClient;
        this.registrationStore = registrationStore;
        this.notificationComposer = notificationComposer;
    }

    /**
     * @throws DraftFeedException if the feed cannot be read or its picks are inconsistent
     */
    public LastPickResult execute(String channelId) throws DraftFeedException {
        Optional<Registration> registration = registrationStore.findByChannel(channelId);
        if (registration.isEmpty()) {
            return new LastPickResult(Status.NO_DRAFT_REGISTERED, null, null);
        }

        String draftId = registration.get().draftId();
        DraftSnapshot snapshot = draftFeedClient.fetch(draftId);
        if (snapshot.settings().status() == DraftStatus.PRE_DRAFT || snapshot.picks().isEmpty()) {
            return new LastPickResult(Status.NOT_STARTED, draftId, null);
        }

        Optional<String> violation = DraftMonitor.findIntegrityViolation(snapshot, 0);
        if (violation.isPresent()) {
            throw DraftFeedException.malformed(draftId, violation.get());
        }

        Pick lastPick = snapshot.picks().get(snapshot.pickCount() - 1);
        PickNotification notification = notificationComposer.compose(
            PickOrderResolver.resolve(snapshot.settings(), lastPick),
            PickOrderResolver.projectNext(snapshot.settings(), lastPick.globalIndex()),
            false
        );
        return new LastPickResult(Status.OK, draftId, notification);
    }

    public enum Status {
        OK,
        NO_DRAFT_REGISTERED,
        NOT_STARTED
    }

    public record LastPickResult(Status status, String draftId, PickNotification notification) {}
}
