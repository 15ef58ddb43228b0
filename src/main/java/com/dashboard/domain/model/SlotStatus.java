package com.dashboard.domain.model;

import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of one cache slot. loadedAt and ageSeconds are null for an empty slot.
 */
@Value
public class SlotStatus {

    boolean fresh;
    Instant loadedAt;
    Double ageSeconds;

    public static SlotStatus empty() {
        return new SlotStatus(false, null, null);
    }
}
