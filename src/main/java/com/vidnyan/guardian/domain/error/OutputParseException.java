package com.vidnyan.guardian.domain.error;

/**
 * Analyzer output does not match the structure its format tag promises.
 */
public class OutputParseException extends GuardianException {

    public OutputParseException(String message) {
        super(message);
    }

    public OutputParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
