package com.kbhealth.backend.exception;

/**
 * Unknown source, article, rule or audit run id.
 */
public class NotFoundException extends KbHealthException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String resourceType, String resourceId) {
        super("NOT_FOUND", resourceType + " not found: " + resourceId);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static NotFoundException source(String sourceId) {
        return new NotFoundException("Data source", sourceId);
    }

    public static NotFoundException article(String articleId) {
        return new NotFoundException("Article", articleId);
    }

    public static NotFoundException rule(String ruleId) {
        return new NotFoundException("Audit rule", ruleId);
    }

    public static NotFoundException auditRun(String auditRunId) {
        return new NotFoundException("Audit run", auditRunId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
