package com.dashboard.domain.service;

import com.dashboard.domain.exception.FeatureNotFoundException;
import com.dashboard.domain.exception.InvalidArgumentException;
import com.dashboard.domain.model.Column;
import com.dashboard.domain.model.ColumnType;
import com.dashboard.domain.model.ColumnarDataset;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Restricts a dataset to an inclusive calendar-date window.
 *
 * The window runs from {@code start 00:00:00} to {@code end 23:59:59}. A time of
 * day on either bound is ignored. When a bound is missing the input is returned
 * as is; supplied bounds are still validated.
 */
@Slf4j
@Component
public class RangeFilter {

    static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

    /**
     * @return the input itself when a bound is absent, otherwise a new dataset with
     *         the timestamp and feature columns of the rows inside the window
     */
    public ColumnarDataset filter(ColumnarDataset dataset, String feature, String startDate, String endDate) {
        LocalDate start = parseDate("startDate", startDate);
        LocalDate end = parseDate("endDate", endDate);
        if (start == null || end == null) {
            return dataset;
        }
        Column<?> column = dataset.column(feature);
        if (column == null) {
            throw new FeatureNotFoundException(feature);
        }
        if (column.type() != ColumnType.CATEGORICAL) {
            throw new InvalidArgumentException("feature",
                    "Feature '" + feature + "' is " + column.type().name().toLowerCase(Locale.ROOT) + ", not categorical");
        }

        LocalDateTime from = start.atStartOfDay();
        LocalDateTime to = end.atTime(END_OF_DAY);

        List<LocalDateTime> timestamps = dataset.timestamps();
        List<Integer> kept = new ArrayList<>();
        for (int row = 0; row < timestamps.size(); row++) {
            LocalDateTime ts = timestamps.get(row);
            if (!ts.isBefore(from) && !ts.isAfter(to)) {
                kept.add(row);
            }
        }

        log.debug("Range [{}, {}] kept {} of {} rows", from, to, kept.size(), dataset.rowCount());
        return dataset.select(List.of(ColumnarDataset.TIMESTAMP, feature), kept);
    }

    static LocalDate parseDate(String field, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException notADate) {
            try {
                return LocalDateTime.parse(value).toLocalDate();
            } catch (DateTimeParseException e) {
                throw new InvalidArgumentException(field,
                        "Invalid " + field + " '" + raw + "': expected YYYY-MM-DD", e);
            }
        }
    }
}
