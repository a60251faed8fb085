package com.pickalert.application.usecase;

import com.pickalert.domain.model.DraftSnapshot;
import com.pickalert.domain.model.Registration;
import com.pickalert.domain.ports.DraftFeedClient;
import com.pickalert.domain.ports.DraftFeedException;
import com.pickalert.domain.ports.RegistrationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Use case for binding drafts to channels and unbinding them.
 */
@Service
public class RegisterDraftUseCase {

    private static final Logger logger = LoggerFactory.getLogger(RegisterDraftUseCase.class);

    private final DraftFeedClient draftFeedClient;
    private final RegistrationStore registrationStore;

    public RegisterDraftUseCase(DraftFeedClient draftFeedClient, RegistrationStore registrationStore) {
        this.draftFeedClient = draftFeedClient;
        this.registrationStore = registrationStore;
    }

    /**
     * Starts monitoring a draft for a channel. Any other draft bound to that channel is dropped.
     * Picks already made are not announced.
     *
     * @throws DraftFeedException if the draft cannot be read from the host
     */
    public Registration register(String draftId, String channelId) throws DraftFeedException {
        requireText(draftId, "draftId");
        requireText(channelId, "channelId");

        DraftSnapshot snapshot = draftFeedClient.fetch(draftId.trim());
        Registration registration = registrationStore.register(draftId.trim(), channelId.trim(), snapshot.pickCount());
        logger.info("Registered draft {} to channel {} at {} picks",
            registration.draftId(), registration.channelId(), registration.lastKnownPickCount());
        return registration;
    }

    public boolean unregister(String draftId) {
        requireText(draftId, "draftId");
        boolean removed = registrationStore.unregister(draftId.trim());
        if (removed) {
            logger.info("Unregistered draft {}", draftId);
        }
        return removed;
    }

    public List<Registration> list() {
        return registrationStore.findAll();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
