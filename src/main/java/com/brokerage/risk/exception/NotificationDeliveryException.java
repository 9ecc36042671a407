package com.brokerage.risk.exception;

import lombok.Getter;

@Getter
public class NotificationDeliveryException extends RuntimeException {

    private final String channel;

    public NotificationDeliveryException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public NotificationDeliveryException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }
}
