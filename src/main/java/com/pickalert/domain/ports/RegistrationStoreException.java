package com.pickalert.domain.ports;

/**
 * Storage failure while reading or writing registrations.
 */
public class RegistrationStoreException extends RuntimeException {

    public RegistrationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
