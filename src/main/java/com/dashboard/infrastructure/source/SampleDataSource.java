package com.dashboard.infrastructure.source;

import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.DatasetKind;
import com.dashboard.domain.source.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generated demo datasets, one row per day going back from now.
 *
 * Line rows cycle fixed numeric patterns. Bar rows draw each categorical
 * feature at random, so two loads differ unless a seed is configured.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.analytics.provider", havingValue = "sample", matchIfMissing = true)
public class SampleDataSource implements DataSource {

    static final int[] X = {1, 2, 3, 4, 5};
    static final int[] Y = {1, 7, 2, 4, 7};
    static final int[] Z = {3, 2, 1, 2, 3};
    static final int[] J = {6, 1, 8, 5, 6};

    static final List<String> STATUSES = List.of("active", "pending", "completed", "failed", "cancelled");
    static final List<String> PRIORITIES = List.of("low", "medium", "high", "critical");
    static final List<String> CATEGORIES = List.of("meeting", "review", "workshop", "planning", "break", "deployment");
    static final List<String> USERS = List.of("alice", "bob", "charlie", "diana", "eve", "frank");
    static final List<String> LOCATIONS = List.of("office", "remote", "meeting_room", "conference_center");

    private final Clock clock;
    private final int lineRows;
    private final int barRows;
    private final Random random;

    public SampleDataSource(Clock clock,
                            @Value("${app.analytics.sample.line-rows:50}") int lineRows,
                            @Value("${app.analytics.sample.bar-rows:30}") int barRows,
                            @Value("${app.analytics.sample.seed:#{null}}") Long seed) {
        this.clock = clock;
        this.lineRows = lineRows;
        this.barRows = barRows;
        this.random = seed != null ? new Random(seed) : new Random();
    }

    @Override
    public ColumnarDataset load(DatasetKind kind) {
        log.debug("Generating sample {} dataset", kind.slotName());
        return switch (kind) {
            case LINE -> lineDataset();
            case BAR -> barDataset();
        };
    }

    private ColumnarDataset lineDataset() {
        List<Integer> x = new ArrayList<>(lineRows);
        List<Integer> y = new ArrayList<>(lineRows);
        List<Integer> z = new ArrayList<>(lineRows);
        List<Integer> j = new ArrayList<>(lineRows);
        for (int i = 0; i < lineRows; i++) {
            x.add(X[i % X.length]);
            y.add(Y[i % Y.length]);
            z.add(Z[i % Z.length]);
            j.add(J[i % J.length]);
        }
        return ColumnarDataset.builder()
                .numeric("x", x)
                .numeric("y", y)
                .numeric("z", z)
                .numeric("j", j)
                .timestamps(dailyTimestamps(lineRows))
                .build();
    }

    private ColumnarDataset barDataset() {
        return ColumnarDataset.builder()
                .timestamps(dailyTimestamps(barRows))
                .categorical("status", draw(STATUSES))
                .categorical("priority", draw(PRIORITIES))
                .categorical("category", draw(CATEGORIES))
                .categorical("user", draw(USERS))
                .categorical("location", draw(LOCATIONS))
                .build();
    }

    private List<LocalDateTime> dailyTimestamps(int rows) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<LocalDateTime> timestamps = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            timestamps.add(now.minusDays(i));
        }
        return timestamps;
    }

    private List<String> draw(List<String> choices) {
        List<String> values = new ArrayList<>(barRows);
        for (int i = 0; i < barRows; i++) {
            values.add(choices.get(random.nextInt(choices.size())));
        }
        return values;
    }
}
