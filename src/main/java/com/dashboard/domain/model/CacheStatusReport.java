package com.dashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Cache status for display. Ages and TTL are in minutes, one decimal place.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatusReport {

    private Map<String, SlotView> slots;
    private double ttlMinutes;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SlotView {
        private boolean fresh;
        private String lastLoad;
        private Double ageMinutes;
    }
}
