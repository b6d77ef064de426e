package org.be.activityservice.enums;

public enum FitMethod {
    EXTREME_VALUE("extreme_value"),
    QUANTILE("quantile");

    private final String tag;

    FitMethod(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
