package com.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Dashboard Analytics Backend
 *
 * Serves the dashboard's precomputed analytics views from a time-limited
 * snapshot cache over the analytics data source.
 *
 * Architecture:
 * - REST APIs for the line series, the bar histogram and cache administration
 * - In-process TTL cache, one whole-dataset snapshot per view
 * - Date-window filtering and hour/day/week/month/quarter bucketing
 * - Pluggable data source (generated sample data or the events table)
 */
@SpringBootApplication
public class DashboardAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(DashboardAnalyticsApplication.class, args);
    }
}
