package io.github.drompincen.clawguard.runtime.errors;

/**
 * Base class for every failure raised by the authorization runtime. None of them are retried internally.
 */
public class ClawGuardException extends RuntimeException {

    public ClawGuardException(String message) {
        super(message);
    }

    public ClawGuardException(String message, Throwable cause) {
        super(message, cause);
    }
}
