package com.pickalert.domain.ports;

import java.util.Optional;

/**
 * Port for turning a draft host user id into something readable in chat.
 */
public interface NameResolver {

    /**
     * @param externalId user id on the draft host
     * @return display handle, or empty if the user is unknown
     */
    Optional<String> resolve(String externalId);

    /**
     * Same as {@link #resolve(String)} but in a form that notifies the user.
     */
    default Optional<String> resolveMention(String externalId) {
        return resolve(externalId);
    }
}
