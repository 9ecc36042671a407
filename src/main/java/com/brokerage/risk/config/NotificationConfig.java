package com.brokerage.risk.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "notification")
public class NotificationConfig {

    private Slack slack = new Slack();

    private Email email = new Email();

    private Twilio twilio = new Twilio();

    private Retry retry = new Retry();

    @Bean
    public RestTemplate notificationRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(5))
                .setReadTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Data
    public static class Slack {
        private boolean enabled = false;
        private String webhookUrl = "";
    }

    @Data
    public static class Email {
        private boolean enabled = false;
        private String from = "risk-engine@localhost";
        private String to = "";
    }

    @Data
    public static class Twilio {
        private boolean enabled = false;
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String toNumber;
        private String channel = "sms";  // "sms" or "whatsapp"
    }

    @Data
    public static class Retry {
        // Attempts per channel per alert, including the first
        private int maxAttempts = 3;
        private long baseDelayMs = 500;
        private double jitterFactor = 0.2;
    }
}
