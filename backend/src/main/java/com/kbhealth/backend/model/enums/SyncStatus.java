package com.kbhealth.backend.model.enums;

/**
 * Lifecycle of a data source. Transitions happen only through the source registry:
 * any non-syncing state moves to {@link #SYNCING} on begin, and a completed run moves
 * to {@link #SUCCESS}, {@link #ERROR} or {@link #CANCELLED}. There is no terminal state.
 */
public enum SyncStatus {
    IDLE,
    SYNCING,
    SUCCESS,
    ERROR,
    CANCELLED;

    public boolean isSyncing() {
        return this == SYNCING;
    }
}
