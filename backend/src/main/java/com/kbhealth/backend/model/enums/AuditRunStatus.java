package com.kbhealth.backend.model.enums;

public enum AuditRunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
