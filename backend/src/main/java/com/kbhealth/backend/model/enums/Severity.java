package com.kbhealth.backend.model.enums;

/**
 * Issue severity with the number of points it deducts from an article's health score.
 */
public enum Severity {
    LOW(5),
    MEDIUM(15),
    HIGH(30),
    CRITICAL(50);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    public boolean isMoreSevereThan(Severity other) {
        return other == null || this.ordinal() > other.ordinal();
    }

    public String getLabel() {
        return name().toLowerCase();
    }

    public static Severity fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(label.trim())) {
                return severity;
            }
        }
        return null;
    }
}
