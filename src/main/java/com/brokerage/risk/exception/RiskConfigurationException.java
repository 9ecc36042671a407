package com.brokerage.risk.exception;

/**
 * Missing or invalid threshold/connection configuration. Fatal at startup.
 */
public class RiskConfigurationException extends RuntimeException {

    public RiskConfigurationException(String message) {
        super(message);
    }

    public RiskConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
