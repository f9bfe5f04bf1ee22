package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.skill.AnalysisWindow;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Concrete date ranges for one run: the analysis period and the equally long
 * period right before it, used for trend comparison. All bounds are UTC.
 */
public record TimeWindows(
        AnalysisWindow window,
        Instant        analysisStart,
        Instant        analysisEnd,
        Instant        previousStart,
        Instant        previousEnd) {

    public static TimeWindows resolve(AnalysisWindow window, Instant now) {
        ZonedDateTime utcNow = now.atZone(ZoneOffset.UTC);
        LocalDate today = utcNow.toLocalDate();
        Instant start = switch (window) {
            case CURRENT_QUARTER -> {
                int firstMonth = ((today.getMonthValue() - 1) / 3) * 3 + 1;
                yield LocalDate.of(today.getYear(), firstMonth, 1).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            case CURRENT_MONTH -> today.withDayOfMonth(1).atStartOfDay(ZoneOffset.UTC).toInstant();
            case TRAILING_90D  -> now.minus(Duration.ofDays(90));
            case TRAILING_30D  -> now.minus(Duration.ofDays(30));
            case TRAILING_7D   -> now.minus(Duration.ofDays(7));
            case ALL_TIME      -> Instant.EPOCH;
        };
        Duration span = Duration.between(start, now);
        Instant previousStart = window == AnalysisWindow.ALL_TIME ? Instant.EPOCH : start.minus(span);
        return new TimeWindows(window, start, now, previousStart, start);
    }

    public boolean contains(Instant t) {
        return t != null && !t.isBefore(analysisStart) && !t.isAfter(analysisEnd);
    }
}
