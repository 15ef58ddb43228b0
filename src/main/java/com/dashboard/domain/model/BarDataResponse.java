package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Histogram payload for the bar chart.
 *
 * binSize echoes the requested value, even when it fell back to daily buckets.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BarDataResponse {

    private List<AggregationRecord> data;
    private String feature;
    private String binSize;
}
