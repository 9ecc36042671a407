package com.brokerage.risk.notification;

import com.brokerage.risk.config.NotificationConfig;
import com.brokerage.risk.exception.NotificationDeliveryException;
import com.brokerage.risk.model.Alert;
import com.twilio.Twilio;
import com.twilio.exception.TwilioException;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * SMS or WhatsApp alert through Twilio.
 */
@Component
public class TwilioSmsChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(TwilioSmsChannel.class);

    private final NotificationConfig.Twilio config;
    private final AlertMessageFormatter formatter;

    public TwilioSmsChannel(NotificationConfig notificationConfig, AlertMessageFormatter formatter) {
        this.config = notificationConfig.getTwilio();
        this.formatter = formatter;
    }

    @PostConstruct
    public void init() {
        if (config.isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio notification channel initialized. Channel: {}", config.getChannel());
        } else {
            log.info("Twilio notification channel is DISABLED.");
        }
    }

    @Override
    public String getName() {
        return config.getChannel();
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled();
    }

    @Override
    public void deliver(Alert alert) {
        try {
            Message message = Message.creator(
                    new PhoneNumber(resolveNumber(config.getToNumber())),
                    new PhoneNumber(resolveNumber(config.getFromNumber())),
                    formatter.shortBody(alert)
            ).create();
            log.debug("Twilio notification sent for alert={}, sid={}", alert.getAlertId(), message.getSid());
        } catch (TwilioException e) {
            throw new NotificationDeliveryException(getName(), "Twilio send failed: " + e.getMessage(), e);
        }
    }

    private String resolveNumber(String number) {
        if ("whatsapp".equalsIgnoreCase(config.getChannel())) {
            return "whatsapp:" + number;
        }
        return number;
    }
}
