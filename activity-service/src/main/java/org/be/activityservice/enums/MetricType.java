package org.be.activityservice.enums;

public enum MetricType {
    MENTIONS("Mentions"),
    EVENTS("Events");

    private final String description;

    MetricType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
