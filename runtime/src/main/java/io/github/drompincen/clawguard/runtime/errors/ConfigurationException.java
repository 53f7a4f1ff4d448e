package io.github.drompincen.clawguard.runtime.errors;

/**
 * Invalid or incomplete setup, detected before any action runs.
 */
public class ConfigurationException extends ClawGuardException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
