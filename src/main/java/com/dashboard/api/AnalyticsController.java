package com.dashboard.api;

import com.dashboard.domain.model.BarDataResponse;
import com.dashboard.domain.model.CacheStatusReport;
import com.dashboard.domain.service.AnalyticsQueryService;
import com.dashboard.domain.service.CacheAdmin;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for the dashboard analytics views.
 *
 * Endpoints:
 * - GET /api/v1/analytics/line-data - Raw time series for the line chart
 * - GET /api/v1/analytics/bar-features - Features available to the bar chart
 * - GET /api/v1/analytics/bar-data - Bucketed value counts for one feature
 * - POST /api/v1/analytics/cache/clear - Drop every cached snapshot
 * - GET /api/v1/analytics/cache/status - Freshness and age of each snapshot
 */
@Slf4j
@RestController
@Validated
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
public class AnalyticsController {

    private final AnalyticsQueryService analyticsQueryService;
    private final CacheAdmin cacheAdmin;

    /**
     * Line chart series.
     *
     * GET /api/v1/analytics/line-data?query=xxx
     *
     * Response: column name to values; timestamps as ISO-8601 strings.
     */
    @GetMapping("/line-data")
    public ResponseEntity<Map<String, List<Object>>> getLineData(
            @RequestParam(defaultValue = "default") String query) {

        log.info("Line data: query={}", query);

        return ResponseEntity.ok(analyticsQueryService.getLineData(query).toWireFormat());
    }

    @GetMapping("/bar-features")
    public ResponseEntity<Map<String, List<String>>> getBarFeatures() {
        return ResponseEntity.ok(Map.of("features", analyticsQueryService.getAvailableFeatures()));
    }

    /**
     * Bar chart histogram.
     *
     * GET /api/v1/analytics/bar-data?feature=status&startDate=2024-01-01&endDate=2024-01-31&binSize=1W
     *
     * Query Parameters:
     * - feature (required): Categorical column to count
     * - startDate, endDate (optional): Inclusive YYYY-MM-DD window, applied only when both are set
     * - binSize (optional): 1H, 1D, 1W, 1M or 3M (default 1D; unknown values use 1D)
     */
    @GetMapping("/bar-data")
    public ResponseEntity<BarDataResponse> getBarData(
            @RequestParam @NotBlank String feature,
            @RequestParam(required = false) String startDate,
            @RequestParam(required = false) String endDate,
            @RequestParam(defaultValue = "1D") String binSize) {

        log.info("Bar data: feature={}, startDate={}, endDate={}, binSize={}", feature, startDate, endDate, binSize);

        return ResponseEntity.ok(analyticsQueryService.getBarData(feature, startDate, endDate, binSize));
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Clear cache requested");

        cacheAdmin.clear();

        return ResponseEntity.ok(Map.of("message", "Cache cleared successfully"));
    }

    @GetMapping("/cache/status")
    public ResponseEntity<CacheStatusReport> getCacheStatus() {
        return ResponseEntity.ok(cacheAdmin.status());
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
