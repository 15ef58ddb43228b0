package com.dashboard.infrastructure.cache;

import com.dashboard.domain.exception.AnalyticsException;
import com.dashboard.domain.exception.AnalyticsOperationException;
import com.dashboard.domain.exception.DataSourceUnavailableException;
import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.DatasetKind;
import com.dashboard.domain.model.SlotStatus;
import com.dashboard.domain.source.DataSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process TTL cache holding one whole-dataset snapshot per {@link DatasetKind}.
 *
 * Freshness is checked lazily on access. A slot is fresh while
 * {@code now - loadedAt < ttl}; an empty slot is never fresh.
 *
 * Concurrency:
 * - Slots are immutable pairs swapped atomically, so a reader never sees a
 *   snapshot with another write's load time.
 * - Refreshes are single-flight per slot. Callers that find the slot stale
 *   queue on the slot lock and re-check before loading.
 *
 * Failure Handling:
 * - A failed load leaves the slot as it was and the error propagates.
 * - Stale data is never served in place of a failed refresh.
 */
@Slf4j
public class DatasetCache {

    private final DataSource dataSource;
    private final Clock clock;
    private final Duration ttl;
    private final MeterRegistry meterRegistry;

    private final Map<DatasetKind, CacheSlot> slots = new ConcurrentHashMap<>();
    private final Map<DatasetKind, ReentrantLock> refreshLocks = new EnumMap<>(DatasetKind.class);

    public DatasetCache(DataSource dataSource, Clock clock, Duration ttl, MeterRegistry meterRegistry) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("Cache TTL must be positive: " + ttl);
        }
        this.dataSource = dataSource;
        this.clock = clock;
        this.ttl = ttl;
        this.meterRegistry = meterRegistry;
        for (DatasetKind kind : DatasetKind.values()) {
            refreshLocks.put(kind, new ReentrantLock());
        }
    }

    public Duration ttl() {
        return ttl;
    }

    /**
     * Returns the cached snapshot if fresh, otherwise loads, stores and returns a new one.
     */
    public ColumnarDataset getOrRefresh(DatasetKind kind) {
        CacheSlot slot = slots.get(kind);
        if (isFresh(slot, clock.instant())) {
            recordLookup(kind, "hit");
            log.debug("Using cached {} data (loaded {})", kind.slotName(), slot.getLoadedAt());
            return slot.getSnapshot();
        }

        ReentrantLock lock = refreshLocks.get(kind);
        lock.lock();
        try {
            // Another caller may have refreshed while we waited
            slot = slots.get(kind);
            if (isFresh(slot, clock.instant())) {
                recordLookup(kind, "hit");
                return slot.getSnapshot();
            }
            recordLookup(kind, "miss");
            return refresh(kind);
        } finally {
            lock.unlock();
        }
    }

    public void invalidate(DatasetKind kind) {
        slots.remove(kind);
        Counter.builder("analytics.cache.invalidations")
                .tag("slot", kind.slotName())
                .register(meterRegistry)
                .increment();
        log.info("Invalidated {} cache slot", kind.slotName());
    }

    public void invalidateAll() {
        for (DatasetKind kind : DatasetKind.values()) {
            invalidate(kind);
        }
    }

    /**
     * Pure read of a slot's state. Never triggers a load.
     */
    public SlotStatus status(DatasetKind kind) {
        CacheSlot slot = slots.get(kind);
        if (slot == null) {
            return SlotStatus.empty();
        }
        Instant now = clock.instant();
        double ageSeconds = Duration.between(slot.getLoadedAt(), now).toMillis() / 1000.0;
        return new SlotStatus(isFresh(slot, now), slot.getLoadedAt(), ageSeconds);
    }

    private ColumnarDataset refresh(DatasetKind kind) {
        log.info("Loading fresh {} data", kind.slotName());
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "failure";
        try {
            ColumnarDataset snapshot = dataSource.load(kind);
            if (snapshot == null) {
                throw new DataSourceUnavailableException(kind, "Data source returned no " + kind.slotName() + " dataset");
            }
            Instant loadedAt = clock.instant();
            slots.put(kind, new CacheSlot(snapshot, loadedAt));
            outcome = "success";
            log.info("Loaded {} data: {} rows", kind.slotName(), snapshot.rowCount());
            return snapshot;

        } catch (AnalyticsException e) {
            log.error("Refresh of {} cache slot failed: {}", kind.slotName(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected error refreshing {} cache slot", kind.slotName(), e);
            throw new AnalyticsOperationException("getOrRefresh", kind.slotName(), e);
        } finally {
            sample.stop(Timer.builder("analytics.cache.refresh")
                    .tag("slot", kind.slotName())
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    private boolean isFresh(CacheSlot slot, Instant now) {
        if (slot == null) {
            return false;
        }
        return Duration.between(slot.getLoadedAt(), now).compareTo(ttl) < 0;
    }

    private void recordLookup(DatasetKind kind, String result) {
        Counter.builder("analytics.cache")
                .tag("slot", kind.slotName())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
