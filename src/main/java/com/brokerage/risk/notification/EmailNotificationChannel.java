package com.brokerage.risk.notification;

import com.brokerage.risk.config.NotificationConfig;
import com.brokerage.risk.exception.NotificationDeliveryException;
import com.brokerage.risk.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Component;

/**
 * Plain-text alert email over SMTP. Needs {@code spring.mail.*} to be set so
 * that a {@link JavaMailSender} exists.
 */
@Component
public class EmailNotificationChannel implements NotificationChannel {

    private static final Logger log = LoggerFactory.getLogger(EmailNotificationChannel.class);

    private final NotificationConfig.Email config;
    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final AlertMessageFormatter formatter;

    public EmailNotificationChannel(NotificationConfig notificationConfig,
                                    ObjectProvider<JavaMailSender> mailSenderProvider,
                                    AlertMessageFormatter formatter) {
        this.config = notificationConfig.getEmail();
        this.mailSenderProvider = mailSenderProvider;
        this.formatter = formatter;
    }

    @Override
    public String getName() {
        return "email";
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled() && config.getTo() != null && !config.getTo().isBlank();
    }

    @Override
    public void deliver(Alert alert) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            throw new NotificationDeliveryException(getName(), "No JavaMailSender configured (spring.mail.host)");
        }

        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(config.getFrom());
        message.setTo(config.getTo().split("\\s*,\\s*"));
        message.setSubject(formatter.subject(alert));
        message.setText(formatter.body(alert));

        try {
            mailSender.send(message);
            log.debug("Alert email sent for alert={} to {}", alert.getAlertId(), config.getTo());
        } catch (MailException e) {
            throw new NotificationDeliveryException(getName(), "SMTP send failed: " + e.getMessage(), e);
        }
    }
}
