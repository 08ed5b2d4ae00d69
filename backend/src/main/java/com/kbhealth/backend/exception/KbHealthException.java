package com.kbhealth.backend.exception;

/**
 * Base class for failures raised by the sync and audit services.
 */
public class KbHealthException extends RuntimeException {

    private final String errorCode;

    public KbHealthException(String message) {
        super(message);
        this.errorCode = "KB_HEALTH_ERROR";
    }

    public KbHealthException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "KB_HEALTH_ERROR";
    }

    public KbHealthException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public KbHealthException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
