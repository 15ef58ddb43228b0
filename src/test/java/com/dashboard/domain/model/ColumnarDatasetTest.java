package com.dashboard.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ColumnarDatasetTest {

    @Test
    void testBuild_RejectsMissingTimestampColumn() {
        assertThrows(IllegalArgumentException.class, () -> ColumnarDataset.builder()
                .categorical("status", List.of("active"))
                .build());
    }

    @Test
    void testBuild_RejectsMisalignedColumns() {
        assertThrows(IllegalArgumentException.class, () -> ColumnarDataset.builder()
                .timestamps(List.of(LocalDateTime.of(2024, 1, 1, 0, 0)))
                .categorical("status", List.of("active", "failed"))
                .build());
    }

    @Test
    void testBuild_RejectsSecondTemporalColumn() {
        assertThrows(IllegalArgumentException.class, () -> ColumnarDataset.builder()
                .timestamps(List.of(LocalDateTime.of(2024, 1, 1, 0, 0)))
                .column("createdAt", new TemporalColumn(List.of(LocalDateTime.of(2024, 1, 1, 0, 0))))
                .build());
    }

    @Test
    void testBuild_RejectsNullValues() {
        assertThrows(NullPointerException.class, () -> new CategoricalColumn(java.util.Arrays.asList("a", null)));
    }

    @Test
    void testToWireFormat_RendersTimestampsAsIsoStrings() {
        ColumnarDataset dataset = ColumnarDataset.builder()
                .numeric("x", List.of(1, 2))
                .timestamps(List.of(LocalDateTime.of(2024, 1, 1, 9, 30), LocalDateTime.of(2024, 1, 2, 0, 0, 5)))
                .build();

        Map<String, List<Object>> wire = dataset.toWireFormat();

        assertEquals(List.of("x", "timestamp"), List.copyOf(wire.keySet()));
        assertEquals(List.of("2024-01-01T09:30:00", "2024-01-02T00:00:05"), wire.get("timestamp"));
        assertEquals(List.of(1, 2), wire.get("x"));
    }

    @Test
    void testSelect_KeepsRowOrder() {
        ColumnarDataset dataset = ColumnarDataset.builder()
                .timestamps(List.of(
                        LocalDateTime.of(2024, 1, 1, 0, 0),
                        LocalDateTime.of(2024, 1, 2, 0, 0),
                        LocalDateTime.of(2024, 1, 3, 0, 0)))
                .categorical("status", List.of("a", "b", "c"))
                .build();

        ColumnarDataset selected = dataset.select(List.of("timestamp", "status"), List.of(0, 2));

        assertEquals(List.of("a", "c"), selected.column("status").values());
        assertEquals(3, dataset.rowCount());
    }
}
