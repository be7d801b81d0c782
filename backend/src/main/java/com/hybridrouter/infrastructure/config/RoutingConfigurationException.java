package com.hybridrouter.infrastructure.config;

/**
 * Malformed routing configuration. Fatal at startup; rejected without effect on live reload.
 */
public class RoutingConfigurationException extends RuntimeException {

    public RoutingConfigurationException(String message) {
        super(message);
    }

    public RoutingConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
