package com.kbhealth.backend.model.enums;

public enum RuleCategory {
    CONTENT_QUALITY("content-quality"),
    SEO("seo"),
    ACCESSIBILITY("accessibility"),
    FRESHNESS("freshness"),
    STRUCTURE("structure"),
    TECHNICAL("technical"),
    // Synthetic issues raised by the audit engine itself (timeouts, rule crashes)
    ENGINE("engine");

    private final String label;

    RuleCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static RuleCategory fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (RuleCategory category : values()) {
            if (category.label.equalsIgnoreCase(label.trim()) || category.name().equalsIgnoreCase(label.trim())) {
                return category;
            }
        }
        return null;
    }
}
