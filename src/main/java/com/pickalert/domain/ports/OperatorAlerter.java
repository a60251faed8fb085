package com.pickalert.domain.ports;

/**
 * Port for conditions that need a human to look at them.
 */
public interface OperatorAlerter {

    void alert(String draftId, String message);
}
