package com.dashboard.infrastructure.source;

import com.dashboard.domain.exception.DataSourceUnavailableException;
import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.DatasetKind;
import com.dashboard.domain.source.DataSource;
import com.dashboard.infrastructure.persistence.entity.EventEntity;
import com.dashboard.infrastructure.persistence.repository.EventRepository;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Projects the event record table into analytics datasets.
 *
 * - line: hourly event counts ({@code timestamp}, {@code count})
 * - bar: one row per event with categorical {@code eventType}, {@code source},
 *   {@code status} and {@code tag}
 *
 * Both cover the configured lookback window ending now. Repository failures
 * and an open circuit surface as {@link DataSourceUnavailableException}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "app.analytics.provider", havingValue = "events")
public class EventTableDataSource implements DataSource {

    private final EventRepository eventRepository;
    private final Clock clock;
    private final Duration lookback;

    public EventTableDataSource(EventRepository eventRepository,
                                Clock clock,
                                @Value("${app.analytics.events.lookback-days:30}") int lookbackDays) {
        this.eventRepository = eventRepository;
        this.clock = clock;
        this.lookback = Duration.ofDays(lookbackDays);
    }

    @Override
    @Transactional(readOnly = true, timeout = 10)
    @CircuitBreaker(name = "analyticsSource", fallbackMethod = "loadFallback")
    public ColumnarDataset load(DatasetKind kind) {
        Instant endTime = clock.instant();
        Instant startTime = endTime.minus(lookback);
        long started = System.currentTimeMillis();

        ColumnarDataset dataset = switch (kind) {
            case LINE -> hourlyCounts(startTime, endTime);
            case BAR -> eventAttributes(startTime, endTime);
        };

        log.info("Events table query for {} data: {} rows, {} ms",
                kind.slotName(), dataset.rowCount(), System.currentTimeMillis() - started);
        return dataset;
    }

    private ColumnarDataset hourlyCounts(Instant startTime, Instant endTime) {
        List<Object[]> rows = eventRepository.aggregateEventsByHour(startTime, endTime);
        List<LocalDateTime> hours = new ArrayList<>(rows.size());
        List<Long> counts = new ArrayList<>(rows.size());
        for (Object[] row : rows) {
            hours.add(toLocalDateTime(row[0]));
            counts.add(((Number) row[1]).longValue());
        }
        return ColumnarDataset.builder()
                .timestamps(hours)
                .numeric("count", counts)
                .build();
    }

    private ColumnarDataset eventAttributes(Instant startTime, Instant endTime) {
        List<EventEntity> events = eventRepository.findByTimestampBetweenOrderByTimestampAsc(startTime, endTime);
        List<LocalDateTime> timestamps = new ArrayList<>(events.size());
        List<String> eventTypes = new ArrayList<>(events.size());
        List<String> sources = new ArrayList<>(events.size());
        List<String> statuses = new ArrayList<>(events.size());
        List<String> tags = new ArrayList<>(events.size());
        for (EventEntity event : events) {
            timestamps.add(LocalDateTime.ofInstant(event.getTimestamp(), clock.getZone()));
            eventTypes.add(event.getEventType());
            sources.add(event.getSource());
            statuses.add(event.getStatus());
            tags.add(event.getTag());
        }
        return ColumnarDataset.builder()
                .timestamps(timestamps)
                .categorical("eventType", eventTypes)
                .categorical("source", sources)
                .categorical("status", statuses)
                .categorical("tag", tags)
                .build();
    }

    // JDBC drivers disagree on the type DATE_TRUNC comes back as
    private LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime) {
            return (LocalDateTime) value;
        }
        if (value instanceof Timestamp) {
            return ((Timestamp) value).toLocalDateTime();
        }
        if (value instanceof OffsetDateTime) {
            return LocalDateTime.ofInstant(((OffsetDateTime) value).toInstant(), clock.getZone());
        }
        if (value instanceof Instant) {
            return LocalDateTime.ofInstant((Instant) value, clock.getZone());
        }
        throw new IllegalStateException("Unsupported hour bucket type: "
                + (value == null ? "null" : value.getClass().getName()));
    }

    ColumnarDataset loadFallback(DatasetKind kind, Exception e) {
        log.warn("Events table unavailable for {} data: {}", kind.slotName(), e.getMessage());
        throw new DataSourceUnavailableException(kind,
                "Events table unavailable for " + kind.slotName() + " data", e);
    }
}
