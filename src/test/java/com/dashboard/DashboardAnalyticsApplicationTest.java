package com.dashboard;

import com.dashboard.domain.model.BarDataResponse;
import com.dashboard.domain.model.CacheStatusReport;
import com.dashboard.domain.service.AnalyticsQueryService;
import com.dashboard.domain.service.CacheAdmin;
import com.dashboard.domain.source.DataSource;
import com.dashboard.infrastructure.source.SampleDataSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
        "app.analytics.sample.seed=42",
        "app.cache.ttl-seconds=300"
})
class DashboardAnalyticsApplicationTest {

    @Autowired
    private DataSource dataSource;

    @Autowired
    private AnalyticsQueryService analyticsQueryService;

    @Autowired
    private CacheAdmin cacheAdmin;

    @Test
    void sampleSourceIsTheDefault() {
        assertInstanceOf(SampleDataSource.class, dataSource);
    }

    @Test
    void barQueryPopulatesCache() {
        cacheAdmin.clear();

        BarDataResponse response = analyticsQueryService.getBarData("status", null, null, "1M");

        int total = response.getData().stream().mapToInt(record -> record.getCount()).sum();
        assertEquals(30, total);
        CacheStatusReport status = cacheAdmin.status();
        assertTrue(status.getSlots().get("bar").isFresh());
        assertFalse(status.getSlots().get("line").isFresh());
        assertEquals(5.0, status.getTtlMinutes());
    }
}
