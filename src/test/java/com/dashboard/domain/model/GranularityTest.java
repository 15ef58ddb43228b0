package com.dashboard.domain.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class GranularityTest {

    private static final LocalDateTime FRIDAY_AFTERNOON = LocalDateTime.of(2024, 3, 15, 14, 37, 12);

    @ParameterizedTest
    @CsvSource({
            "HOUR, 2024-03-15 14:00",
            "DAY, 2024-03-15",
            "WEEK, 2024-03-11",
            "MONTH, 2024-03",
            "QUARTER, 2024-Q1"
    })
    void testBucketKey_Formats(Granularity granularity, String expected) {
        assertEquals(expected, granularity.bucketKey(FRIDAY_AFTERNOON));
    }

    @Test
    void testBucketKey_WeekOfMondayIsItself() {
        assertEquals("2024-03-11", Granularity.WEEK.bucketKey(LocalDateTime.of(2024, 3, 11, 0, 0)));
    }

    @Test
    void testBucketKey_WeekCanStartInPreviousYear() {
        assertEquals("2024-12-30", Granularity.WEEK.bucketKey(LocalDateTime.of(2025, 1, 1, 9, 0)));
    }

    @Test
    void testBucketKey_QuarterBoundaries() {
        assertEquals("2024-Q3", Granularity.QUARTER.bucketKey(LocalDateTime.of(2024, 8, 20, 0, 0)));
        assertEquals("2024-Q3", Granularity.QUARTER.bucketKey(LocalDateTime.of(2024, 7, 1, 0, 0)));
        assertEquals("2024-Q4", Granularity.QUARTER.bucketKey(LocalDateTime.of(2024, 12, 31, 23, 59)));
    }

    @Test
    void testBucketKey_IgnoresDefaultLocaleDigits() {
        // Given
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("th-TH-u-nu-thai"));

        try {
            // When / Then
            assertEquals("2024-Q1", Granularity.QUARTER.bucketKey(FRIDAY_AFTERNOON));
            assertEquals("2024-03-15 14:00", Granularity.HOUR.bucketKey(FRIDAY_AFTERNOON));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @ParameterizedTest
    @CsvSource({"1H, HOUR", "1D, DAY", "1W, WEEK", "1M, MONTH", "3M, QUARTER", "2D, DAY", "1d, DAY", "'', DAY"})
    void testFromBinSize_KnownAndUnknownTags(String binSize, Granularity expected) {
        assertEquals(expected, Granularity.fromBinSize(binSize));
    }

    @Test
    void testFromBinSize_NullIsDaily() {
        assertEquals(Granularity.DAY, Granularity.fromBinSize(null));
    }
}
