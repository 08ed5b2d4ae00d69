package com.kbhealth.backend.exception;

/**
 * Thrown when a sync is requested for a source that already has a run in flight.
 * Callers are expected to retry later; the request is never queued.
 */
public class AlreadySyncingException extends KbHealthException {

    private final String sourceId;

    public AlreadySyncingException(String sourceId) {
        super("ALREADY_SYNCING", "Data source is already syncing: " + sourceId);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
