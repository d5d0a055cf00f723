package com.vigil.query;

import com.vigil.domain.LogRecord;
import com.vigil.domain.Severity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Filter, sort and count pipeline over a batch of classified log records.
 * 
 * Every method is a pure function of its arguments: views are recomputed on
 * each request and nothing is cached between calls.
 */
@Component
public class LogQueryPipeline {
    
    /**
     * Records matching the query, in the query's order.
     * Sorting is stable: records with equal keys keep their input order.
     */
    public List<LogRecord> view(List<LogRecord> logs, LogQuery query) {
        List<LogRecord> matched = logs.stream()
            .filter(matcher(query))
            .collect(Collectors.toCollection(ArrayList::new));
        matched.sort(comparator(query.getSortField(), query.getDirection()));
        return matched;
    }
    
    /**
     * The view plus its summary: total records, and severity counts over the matched ones
     */
    public LogView render(List<LogRecord> logs, LogQuery query) {
        List<LogRecord> records = view(logs, query);
        return new LogView(records, logs.size(), countBySeverity(records));
    }
    
    /**
     * Count records per severity, in severity order, with records lacking a
     * severity under {@value Severity#UNKNOWN}. Only non-zero buckets appear.
     */
    public Map<String, Long> countBySeverity(Collection<LogRecord> logs) {
        long[] counts = new long[Severity.values().length];
        long unknown = 0;
        for (LogRecord record : logs) {
            if (record.getSeverity().isPresent()) {
                counts[record.getSeverity().get().getRank()]++;
            } else {
                unknown++;
            }
        }
        Map<String, Long> result = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            if (counts[severity.getRank()] > 0) {
                result.put(severity.getValue(), counts[severity.getRank()]);
            }
        }
        if (unknown > 0) {
            result.put(Severity.UNKNOWN, unknown);
        }
        return result;
    }
    
    /**
     * Count records per type, keyed alphabetically
     */
    public Map<String, Long> countByType(Collection<LogRecord> logs) {
        return logs.stream()
            .collect(Collectors.groupingBy(
                record -> record.getType().orElse(Severity.UNKNOWN),
                TreeMap::new,
                Collectors.counting()));
    }
    
    Predicate<LogRecord> matcher(LogQuery query) {
        Predicate<LogRecord> predicate = record -> true;
        if (query.getText().isPresent()) {
            String needle = query.getText().get().toLowerCase(Locale.ROOT);
            predicate = predicate.and(record -> containsIgnoreCase(record.getSource(), needle)
                || containsIgnoreCase(record.getContent(), needle)
                || record.getType().map(type -> containsIgnoreCase(type, needle)).orElse(false));
        }
        if (query.getSeverity().isPresent()) {
            Severity wanted = query.getSeverity().get();
            predicate = predicate.and(record -> record.getSeverity().map(wanted::equals).orElse(false));
        }
        return predicate;
    }
    
    /**
     * Record ordering for a sort key and direction.
     * 
     * For severity the order is critical, high, medium, low (reversed when
     * descending), and records without a severity come last in both directions.
     */
    Comparator<LogRecord> comparator(LogSortField field, SortDirection direction) {
        switch (field) {
            case SOURCE:
                return directed(Comparator.comparing(LogRecord::getSource, String.CASE_INSENSITIVE_ORDER), direction);
            case SEVERITY:
                Comparator<Severity> known = directed(Comparator.comparingInt(Severity::getRank), direction);
                return Comparator.comparing((LogRecord record) -> record.getSeverity().orElse(null),
                    Comparator.nullsLast(known));
            case TIMESTAMP:
            default:
                return directed(Comparator.comparing(LogRecord::getTimestamp), direction);
        }
    }
    
    private static <T> Comparator<T> directed(Comparator<T> ascending, SortDirection direction) {
        return direction == SortDirection.DESC ? ascending.reversed() : ascending;
    }
    
    private static boolean containsIgnoreCase(String value, String lowerNeedle) {
        return value.toLowerCase(Locale.ROOT).contains(lowerNeedle);
    }
}
