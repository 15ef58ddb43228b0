package com.dashboard.domain.service;

import com.dashboard.domain.exception.DataSourceUnavailableException;
import com.dashboard.domain.exception.FeatureNotFoundException;
import com.dashboard.domain.exception.InvalidArgumentException;
import com.dashboard.domain.model.AggregationRecord;
import com.dashboard.domain.model.BarDataResponse;
import com.dashboard.domain.model.ColumnarDataset;
import com.dashboard.domain.model.DatasetKind;
import com.dashboard.domain.source.DataSource;
import com.dashboard.infrastructure.cache.DatasetCache;
import com.dashboard.support.MutableClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Query flow tests over the real cache, filter and aggregator with a mocked data source.
 */
@ExtendWith(MockitoExtension.class)
class AnalyticsQueryServiceTest {

    @Mock
    private DataSource dataSource;

    private MutableClock clock;
    private AnalyticsQueryService queryService;

    private final ColumnarDataset barData = ColumnarDataset.builder()
            .timestamps(List.of(
                    LocalDateTime.of(2024, 1, 1, 0, 0, 0),
                    LocalDateTime.of(2024, 1, 2, 8, 0),
                    LocalDateTime.of(2024, 1, 3, 23, 59, 59)))
            .categorical("status", List.of("active", "active", "failed"))
            .categorical("priority", List.of("low", "high", "low"))
            .build();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-05T12:00:00Z"));
        MeterRegistry meterRegistry = new SimpleMeterRegistry();
        DatasetCache cache = new DatasetCache(dataSource, clock, Duration.ofMinutes(10), meterRegistry);
        queryService = new AnalyticsQueryService(cache, new RangeFilter(), new BucketAggregator(meterRegistry), meterRegistry);
    }

    @Test
    void testGetBarData_WholeSnapshot() {
        when(dataSource.load(DatasetKind.BAR)).thenReturn(barData);

        BarDataResponse response = queryService.getBarData("status", null, null, "1W");

        assertEquals("status", response.getFeature());
        assertEquals("1W", response.getBinSize());
        assertEquals(List.of(
                new AggregationRecord("2024-01-01", "active", 2),
                new AggregationRecord("2024-01-01", "failed", 1)), response.getData());
    }

    @Test
    void testGetBarData_WindowedDaily() {
        when(dataSource.load(DatasetKind.BAR)).thenReturn(barData);

        BarDataResponse response = queryService.getBarData("priority", "2024-01-02", "2024-01-03", "1D");

        assertEquals(List.of(
                new AggregationRecord("2024-01-02", "high", 1),
                new AggregationRecord("2024-01-03", "low", 1)), response.getData());
    }

    @Test
    void testGetBarData_UnknownBinSizeFallsBackToDaily() {
        when(dataSource.load(DatasetKind.BAR)).thenReturn(barData);

        BarDataResponse daily = queryService.getBarData("status", null, null, "1D");
        BarDataResponse fallback = queryService.getBarData("status", null, null, "2D");

        assertEquals(daily.getData(), fallback.getData());
        assertEquals("2D", fallback.getBinSize());
    }

    @Test
    void testGetBarData_ServedFromCache() {
        when(dataSource.load(DatasetKind.BAR)).thenReturn(barData);

        queryService.getBarData("status", null, null, "1D");
        queryService.getBarData("priority", "2024-01-01", "2024-01-01", "1H");

        verify(dataSource, times(1)).load(DatasetKind.BAR);
    }

    @Test
    void testGetBarData_MissingFeatureIsInvalid() {
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> queryService.getBarData(" ", null, null, "1D"));

        assertEquals("feature", ex.field());
        verifyNoInteractions(dataSource);
    }

    @Test
    void testGetBarData_UnknownFeatureFails() {
        when(dataSource.load(DatasetKind.BAR)).thenReturn(barData);

        assertThrows(FeatureNotFoundException.class, () -> queryService.getBarData("location", null, null, "1D"));
        assertThrows(FeatureNotFoundException.class,
                () -> queryService.getBarData("location", "2024-01-01", "2024-01-02", "1D"));
    }

    @Test
    void testGetBarData_WindowedTimestampFeatureIsInvalid() {
        // Given
        when(dataSource.load(DatasetKind.BAR)).thenReturn(barData);

        // When / Then
        InvalidArgumentException ex = assertThrows(InvalidArgumentException.class,
                () -> queryService.getBarData("timestamp", "2024-01-01", "2024-01-02", "1D"));

        assertEquals("feature", ex.field());
    }

    @Test
    void testGetBarData_SourceFailurePropagates() {
        when(dataSource.load(DatasetKind.BAR))
                .thenThrow(new DataSourceUnavailableException(DatasetKind.BAR, "backend down"));

        assertThrows(DataSourceUnavailableException.class, () -> queryService.getBarData("status", null, null, "1D"));
    }

    @Test
    void testGetLineData_UsesLineSlot() {
        ColumnarDataset lineData = ColumnarDataset.builder()
                .timestamps(List.of(LocalDateTime.of(2024, 1, 1, 0, 0)))
                .numeric("x", List.of(1))
                .build();
        when(dataSource.load(DatasetKind.LINE)).thenReturn(lineData);

        assertSame(lineData, queryService.getLineData("test_query"));
        assertSame(lineData, queryService.getLineData("another_query"));
        verify(dataSource, times(1)).load(DatasetKind.LINE);
    }

    @Test
    void testGetAvailableFeatures_ExcludesTimestampAndNumericColumns() {
        ColumnarDataset mixed = ColumnarDataset.builder()
                .timestamps(List.of(LocalDateTime.of(2024, 1, 1, 0, 0)))
                .categorical("status", List.of("active"))
                .numeric("duration", List.of(3))
                .categorical("user", List.of("alice"))
                .build();
        when(dataSource.load(DatasetKind.BAR)).thenReturn(mixed);

        assertEquals(List.of("status", "user"), queryService.getAvailableFeatures());
    }
}
