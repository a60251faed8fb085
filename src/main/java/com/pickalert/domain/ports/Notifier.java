package com.pickalert.domain.ports;

import com.pickalert.domain.model.PickNotification;

/**
 * Port for delivering pick alerts to a chat channel.
 */
public interface Notifier {

    /**
     * Sends one alert.
     *
     * @param channelId Destination channel
     * @param notification The alert to deliver
     * @throws NotificationDeliveryException if the message was not accepted
     */
    void send(String channelId, PickNotification notification) throws NotificationDeliveryException;
}
