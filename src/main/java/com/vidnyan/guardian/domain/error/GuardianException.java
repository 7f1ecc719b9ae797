package com.vidnyan.guardian.domain.error;

/**
 * Base type for errors raised by the analysis pipeline.
 */
public class GuardianException extends RuntimeException {

    public GuardianException(String message) {
        super(message);
    }

    public GuardianException(String message, Throwable cause) {
        super(message, cause);
    }
}
