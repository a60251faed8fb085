package com.pickalert.domain.ports;

import com.pickalert.domain.model.Registration;

import java.util.List;
import java.util.Optional;

/**
 * Port for persisting which drafts are monitored and how far each has been announced.
 * Implementations signal storage failures with {@link RegistrationStoreException}.
 */
public interface RegistrationStore {

    /**
     * Finds the registration of a draft.
     *
     * @param draftId The draft id
     * @return The registration, or empty if the draft is not monitored
     */
    Optional<Registration> find(String draftId);

    /**
     * Records how many picks of a draft have been announced.
     * Does nothing if the draft is no longer registered.
     */
    void setLastKnownCount(String draftId, int count);

    List<Registration> findAll();

    Optional<Registration> findByChannel(String channelId);

    /**
     * Binds a draft to a channel, removing any other draft bound to the same channel.
     *
     * @param draftId      The draft to monitor
     * @param channelId    Destination channel
     * @param initialCount Number of picks already made, which will not be announced
     * @return The stored registration
     */
    Registration register(String draftId, String channelId, int initialCount);

    /**
     * Removes a draft's registration.
     *
     * @return true if a registration was removed
     */
    boolean unregister(String draftId);
}
