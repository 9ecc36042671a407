package com.brokerage.risk.notification;

import com.brokerage.risk.exception.NotificationDeliveryException;
import com.brokerage.risk.model.Alert;

/**
 * One outbound notification channel. Channels are independent: a failure in
 * one never affects delivery through another.
 */
public interface NotificationChannel {

    /** Short name used in logs and metrics tags. */
    String getName();

    boolean isEnabled();

    /**
     * Deliver one alert. Returns normally on success.
     *
     * @throws NotificationDeliveryException if the channel is unreachable or rejects the alert
     */
    void deliver(Alert alert);
}
