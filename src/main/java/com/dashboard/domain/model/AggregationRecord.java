package com.dashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Count of one feature value inside one time bucket. Serialized as {@code date}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregationRecord {

    @JsonProperty("date")
    private String bucket;
    private String value;
    private int count;
}
