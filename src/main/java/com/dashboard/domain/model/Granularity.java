package com.dashboard.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Time bucket granularities and their bucket-key formats.
 */
public enum Granularity {
    HOUR("1H"),
    DAY("1D"),
    WEEK("1W"),
    MONTH("1M"),
    QUARTER("3M");

    private static final DateTimeFormatter HOUR_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:00", Locale.ROOT);
    private static final DateTimeFormatter DAY_KEY = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ROOT);
    private static final DateTimeFormatter MONTH_KEY = DateTimeFormatter.ofPattern("yyyy-MM", Locale.ROOT);

    private final String binSize;

    Granularity(String binSize) {
        this.binSize = binSize;
    }

    public String binSize() {
        return binSize;
    }

    /**
     * Resolves a wire bin size. Unrecognized or missing values fall back to {@link #DAY}.
     */
    public static Granularity fromBinSize(String binSize) {
        if (binSize != null) {
            for (Granularity granularity : values()) {
                if (granularity.binSize.equals(binSize)) {
                    return granularity;
                }
            }
        }
        return DAY;
    }

    public String bucketKey(LocalDateTime timestamp) {
        return switch (this) {
            case HOUR -> HOUR_KEY.format(timestamp);
            case DAY -> DAY_KEY.format(timestamp);
            case WEEK -> DAY_KEY.format(timestamp.toLocalDate()
                    .with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
            case MONTH -> MONTH_KEY.format(timestamp);
            case QUARTER -> String.format(Locale.ROOT, "%04d-Q%d", timestamp.getYear(), (timestamp.getMonthValue() - 1) / 3 + 1);
        };
    }
}
