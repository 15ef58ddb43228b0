package com.dashboard.domain.exception;

public class FeatureNotFoundException extends AnalyticsException {

    private final String feature;

    public FeatureNotFoundException(String feature) {
        super("Feature not found: " + feature);
        this.feature = feature;
    }

    public String feature() {
        return feature;
    }
}
