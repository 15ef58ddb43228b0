package com.dashboard.domain.service;

import com.dashboard.domain.model.CacheStatusReport;
import com.dashboard.domain.model.DatasetKind;
import com.dashboard.domain.model.SlotStatus;
import com.dashboard.infrastructure.cache.DatasetCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Administrative view over the dataset cache: forced invalidation and status reporting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CacheAdmin {

    private static final DateTimeFormatter LAST_LOAD_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final DatasetCache datasetCache;
    private final Clock clock;

    /**
     * Empties every slot. Safe to call repeatedly.
     */
    public void clear() {
        datasetCache.invalidateAll();
        log.info("Cache cleared");
    }

    public CacheStatusReport status() {
        Map<String, CacheStatusReport.SlotView> slots = new LinkedHashMap<>();
        for (DatasetKind kind : DatasetKind.values()) {
            SlotStatus status = datasetCache.status(kind);
            slots.put(kind.slotName(), CacheStatusReport.SlotView.builder()
                    .fresh(status.isFresh())
                    .lastLoad(status.getLoadedAt() != null
                            ? LAST_LOAD_FORMAT.format(LocalDateTime.ofInstant(status.getLoadedAt(), clock.getZone()))
                            : null)
                    .ageMinutes(status.getAgeSeconds() != null
                            ? roundToTenth(status.getAgeSeconds() / 60.0)
                            : null)
                    .build());
        }
        return CacheStatusReport.builder()
                .slots(slots)
                .ttlMinutes(roundToTenth(datasetCache.ttl().toMillis() / 60_000.0))
                .build();
    }

    static double roundToTenth(double value) {
        return Math.round(value * 10.0) / 10.0;
    }
}
