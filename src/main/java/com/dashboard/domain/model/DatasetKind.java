package com.dashboard.domain.model;

/**
 * Dataset kinds served to the dashboard. Each kind owns one cache slot.
 */
public enum DatasetKind {
    LINE("line"),
    BAR("bar");

    private final String slotName;

    DatasetKind(String slotName) {
        this.slotName = slotName;
    }

    public String slotName() {
        return slotName;
    }
}
