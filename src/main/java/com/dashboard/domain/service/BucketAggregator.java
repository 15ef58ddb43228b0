package com.dashboard.domain.service;

import com.dashboard.domain.exception.FeatureNotFoundException;
import com.dashboard.domain.exception.InvalidArgumentException;
import com.dashboard.domain.model.AggregationRecord;
import com.dashboard.domain.model.CategoricalColumn;
import com.dashboard.domain.model.Column;
import com.dashboard.domain.model.ColumnType;
import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.Granularity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Counts occurrences of each value of a categorical feature per time bucket.
 *
 * Output holds one record per (bucket, value) pair seen in the input, in
 * first-seen order of buckets and, within a bucket, of values. Pairs that never
 * occur are not emitted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BucketAggregator {

    private final MeterRegistry meterRegistry;

    public List<AggregationRecord> aggregate(ColumnarDataset dataset, String feature, Granularity granularity) {
        Column<?> column = dataset.column(feature);
        if (column == null) {
            throw new FeatureNotFoundException(feature);
        }
        if (column.type() != ColumnType.CATEGORICAL) {
            throw new InvalidArgumentException("feature",
                    "Feature '" + feature + "' is " + column.type().name().toLowerCase(Locale.ROOT) + ", not categorical");
        }
        List<String> values = ((CategoricalColumn) column).values();
        List<LocalDateTime> timestamps = dataset.timestamps();

        Map<String, Map<String, Integer>> bins = new LinkedHashMap<>();
        for (int row = 0; row < timestamps.size(); row++) {
            String bucket = granularity.bucketKey(timestamps.get(row));
            bins.computeIfAbsent(bucket, key -> new LinkedHashMap<>())
                    .merge(values.get(row), 1, Integer::sum);
        }

        List<AggregationRecord> result = new ArrayList<>();
        for (Map.Entry<String, Map<String, Integer>> bin : bins.entrySet()) {
            for (Map.Entry<String, Integer> count : bin.getValue().entrySet()) {
                result.add(new AggregationRecord(bin.getKey(), count.getKey(), count.getValue()));
            }
        }

        Counter.builder("analytics.aggregation")
                .tag("granularity", granularity.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
        log.debug("Aggregated {} rows of '{}' into {} buckets ({} records)",
                dataset.rowCount(), feature, bins.size(), result.size());

        return result;
    }
}
