package com.dashboard.domain.service;

import com.dashboard.domain.exception.InvalidArgumentException;
import com.dashboard.domain.model.AggregationRecord;
import com.dashboard.domain.model.BarDataResponse;
import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.DatasetKind;
import com.dashboard.domain.model.Granularity;
import com.dashboard.infrastructure.cache.DatasetCache;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Dashboard analytics queries.
 *
 * Bar Query Flow:
 * 1. Fetch the "bar" snapshot from the cache (refreshing it if stale)
 * 2. Narrow it to the requested date window, if both bounds are given
 * 3. Bucket the rows and count feature values per bucket
 *
 * Snapshots are shared between requests and never modified here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnalyticsQueryService {

    private final DatasetCache datasetCache;
    private final RangeFilter rangeFilter;
    private final BucketAggregator bucketAggregator;
    private final MeterRegistry meterRegistry;

    /**
     * Raw time series for the line chart.
     *
     * The query token is accepted for the routing layer but does not key the
     * cache; every token is served from the single "line" slot.
     */
    public ColumnarDataset getLineData(String query) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            log.debug("Line data requested: query={}", query);
            return datasetCache.getOrRefresh(DatasetKind.LINE);
        } finally {
            sample.stop(Timer.builder("analytics.query.latency")
                    .tag("type", "line")
                    .register(meterRegistry));
        }
    }

    public BarDataResponse getBarData(String feature, String startDate, String endDate, String binSize) {
        if (feature == null || feature.isBlank()) {
            throw new InvalidArgumentException("feature", "Parameter 'feature' is required");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            ColumnarDataset snapshot = datasetCache.getOrRefresh(DatasetKind.BAR);
            ColumnarDataset window = rangeFilter.filter(snapshot, feature, startDate, endDate);
            Granularity granularity = Granularity.fromBinSize(binSize);
            List<AggregationRecord> records = bucketAggregator.aggregate(window, feature, granularity);

            log.info("Bar data: feature={}, window=[{}, {}], binSize={} ({}), {} records",
                    feature, startDate, endDate, binSize, granularity, records.size());

            return BarDataResponse.builder()
                    .data(records)
                    .feature(feature)
                    .binSize(binSize)
                    .build();
        } finally {
            sample.stop(Timer.builder("analytics.query.latency")
                    .tag("type", "bar")
                    .register(meterRegistry));
        }
    }

    /**
     * Categorical columns of the current bar snapshot, excluding {@code timestamp}.
     */
    public List<String> getAvailableFeatures() {
        return datasetCache.getOrRefresh(DatasetKind.BAR).categoricalColumnNames();
    }
}
