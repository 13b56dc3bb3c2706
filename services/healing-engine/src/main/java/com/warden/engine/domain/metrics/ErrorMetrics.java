package com.warden.engine.domain.metrics;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Dashboard view of the error log over a time range, optionally narrowed to one component.
 *
 * @param component the component filter, or {@code null} for all components
 * @param from inclusive start of the range
 * @param to inclusive end of the range
 * @param totalErrors number of entries in the range
 * @param byComponent entry count per component, by component name
 * @param timeDistribution entry count per clock hour, oldest first; hours without errors are omitted
 * @param mostCommonErrors the most frequent messages, most frequent first
 */
public record ErrorMetrics(
        String component,
        Instant from,
        Instant to,
        long totalErrors,
        Map<String, Long> byComponent,
        List<HourlyCount> timeDistribution,
        List<MessageCount> mostCommonErrors) {

    static final int MOST_COMMON_LIMIT = 10;

    public ErrorMetrics {
        byComponent = Collections.unmodifiableMap(new TreeMap<>(byComponent));
        timeDistribution = List.copyOf(timeDistribution);
        mostCommonErrors = List.copyOf(mostCommonErrors);
    }

    /** Errors that fell into one clock hour. */
    public record HourlyCount(Instant timestamp, long count) {
    }

    /** Occurrences of one message. */
    public record MessageCount(String message, long count) {
    }

    static ErrorMetrics of(String component, Instant from, Instant to, List<ErrorLogEntry> entries) {
        Map<String, Long> byComponent = entries.stream()
                .collect(Collectors.groupingBy(ErrorLogEntry::component, TreeMap::new, Collectors.counting()));

        List<HourlyCount> perHour = entries.stream()
                .collect(Collectors.groupingBy(e -> e.timestamp().truncatedTo(ChronoUnit.HOURS), TreeMap::new,
                        Collectors.counting()))
                .entrySet().stream()
                .map(e -> new HourlyCount(e.getKey(), e.getValue()))
                .toList();

        List<MessageCount> mostCommon = entries.stream()
                .collect(Collectors.groupingBy(ErrorLogEntry::message, LinkedHashMap::new, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new MessageCount(e.getKey(), e.getValue()))
                .sorted(Comparator.comparingLong(MessageCount::count).reversed()
                        .thenComparing(MessageCount::message))
                .limit(MOST_COMMON_LIMIT)
                .toList();

        return new ErrorMetrics(component, from, to, entries.size(), byComponent, perHour, mostCommon);
    }
}
