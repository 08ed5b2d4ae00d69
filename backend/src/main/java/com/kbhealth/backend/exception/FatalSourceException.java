package com.kbhealth.backend.exception;

/**
 * The source could not be walked at all, typically because its index page is unreachable.
 */
public class FatalSourceException extends KbHealthException {

    private final String sourceId;

    public FatalSourceException(String sourceId, String message, Throwable cause) {
        super("FATAL_SOURCE", message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
