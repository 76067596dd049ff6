package com.workflow.admission.ratelimit.core;

/**
 * Unknown or invalid limiter configuration. Raised at registration time and whenever a
 * check names a limiter that was never registered.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
