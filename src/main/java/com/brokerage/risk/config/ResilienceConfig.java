package com.brokerage.risk.config;

import com.brokerage.risk.exception.NotificationDeliveryException;
import com.brokerage.risk.exception.TransientStoreException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public Retry feedRetry(RiskThresholdConfig config) {
        RiskThresholdConfig.Pipeline pipeline = config.getPipeline();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(pipeline.getRetryBaseDelayMs()),
                2.0,
                0.2
        );
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(pipeline.getRetryMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(TransientStoreException.class)
                .build();
        return Retry.of("transaction-feed", retryConfig);
    }

    /**
     * Shared policy for notification channels; each channel gets its own
     * {@link Retry} instance built from it.
     */
    @Bean
    public RetryConfig notificationRetryConfig(NotificationConfig config) {
        NotificationConfig.Retry retry = config.getRetry();
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                Duration.ofMillis(retry.getBaseDelayMs()),
                2.0,
                retry.getJitterFactor()
        );
        return RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(NotificationDeliveryException.class)
                .build();
    }
}
