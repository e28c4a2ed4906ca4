package com.anthem.apigw.policy;

/**
 * Raised when the allow-list source cannot be turned into a valid allow-list.
 * Provisioning must stop when this is thrown.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
