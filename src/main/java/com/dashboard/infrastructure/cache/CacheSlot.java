package com.dashboard.infrastructure.cache;

import com.dashboard.domain.model.ColumnarDataset;
import lombok.Value;

import java.time.Instant;

/**
 * A loaded snapshot and the instant it was loaded. Replaced as a unit, never mutated.
 */
@Value
class CacheSlot {

    ColumnarDataset snapshot;
    Instant loadedAt;
}
