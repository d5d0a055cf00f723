package com.vigil.query;

import com.vigil.domain.AlertRecord;
import com.vigil.domain.AnalyticsTimeSeries;
import com.vigil.domain.LogRecord;
import com.vigil.domain.NetworkSample;
import com.vigil.domain.ThreatCount;
import com.vigil.domain.ThreatSummary;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Derived aggregates for the overview and analytics views.
 * 
 * Everything here is recomputed from the raw snapshot payloads on each call.
 * Absent inputs give absent (or empty) outputs, never zero-valued ones.
 */
@Component
public class TelemetryViews {
    
    /**
     * Bucket for alerts missing the grouped field
     */
    public static final String UNKNOWN_BUCKET = "Unknown";
    
    public static final int TOP_PROCESSES = 7;
    
    /**
     * Name shown for process records without one
     */
    public static final String UNKNOWN_PROCESS = "unknown";
    
    static final String PROCESS_NAME = "process_name";
    static final String PROCESS_CPU = "cpu_percent";
    static final String PROCESS_MEMORY = "memory_percent";
    
    /**
     * The newest element of a time-ordered series
     */
    public <T> Optional<T> latest(List<T> series) {
        return series.isEmpty() ? Optional.empty() : Optional.of(series.get(series.size() - 1));
    }
    
    /**
     * Top processes by memory and by CPU.
     * 
     * Takes the first {@value #TOP_PROCESSES} records of type {@code process}
     * and ranks them both ways; unnamed ones are listed as
     * {@value #UNKNOWN_PROCESS} and unmeasured values rank last.
     */
    public ProcessRanking topProcesses(List<LogRecord> logs) {
        List<ProcessUsage> processes = logs.stream()
            .filter(record -> record.getType().filter(LogRecord.TYPE_PROCESS::equals).isPresent())
            .limit(TOP_PROCESSES)
            .map(this::toProcessUsage)
            .collect(Collectors.toList());
        return new ProcessRanking(
            rank(processes, usage -> usage.getMemoryPercent()),
            rank(processes, usage -> usage.getCpuPercent()));
    }
    
    private ProcessUsage toProcessUsage(LogRecord record) {
        String name = record.getAttribute(PROCESS_NAME)
            .map(String::valueOf)
            .filter(value -> !value.isBlank())
            .orElse(UNKNOWN_PROCESS);
        return new ProcessUsage(
            name,
            number(record.getAttribute(PROCESS_CPU)),
            number(record.getAttribute(PROCESS_MEMORY)));
    }
    
    private static List<ProcessUsage> rank(List<ProcessUsage> processes,
                                           Function<ProcessUsage, OptionalDouble> metric) {
        ToDoubleFunction<ProcessUsage> key = usage -> metric.apply(usage).orElse(Double.NEGATIVE_INFINITY);
        List<ProcessUsage> ranked = new ArrayList<>(processes);
        ranked.sort(Comparator.comparingDouble(key).reversed());
        return ranked;
    }
    
    private static Double number(Optional<Object> value) {
        if (value.isEmpty()) {
            return null;
        }
        Object raw = value.get();
        if (raw instanceof Number) {
            return ((Number) raw).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
    
    /**
     * Inbound and outbound throughput over time, outbound converted from kbps to Mbps
     */
    public List<TrafficPoint> networkTraffic(List<NetworkSample> samples) {
        return samples.stream()
            .map(sample -> new TrafficPoint(sample.getTimestamp(), sample.getIncomingMbps(), sample.getOutgoingMbps()))
            .collect(Collectors.toList());
    }
    
    /**
     * The analytics time series as points, truncated to the shortest of its arrays
     */
    public List<PerformancePoint> performanceSeries(AnalyticsTimeSeries series) {
        List<Instant> timestamps = series.getTimestamps();
        List<Double> cpu = series.getCpu();
        List<Double> memory = series.getMemory();
        int length = Math.min(timestamps.size(), Math.min(cpu.size(), memory.size()));
        List<PerformancePoint> points = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            points.add(new PerformancePoint(timestamps.get(i), cpu.get(i), memory.get(i)));
        }
        return points;
    }
    
    /**
     * Alert counts by type, in order of first appearance
     */
    public Map<String, Long> alertCountsByType(Collection<AlertRecord> alerts) {
        return countBy(alerts, AlertRecord::getType);
    }
    
    /**
     * Alert counts by severity, in order of first appearance
     */
    public Map<String, Long> alertCountsBySeverity(Collection<AlertRecord> alerts) {
        return countBy(alerts, AlertRecord::getSeverity);
    }
    
    private static Map<String, Long> countBy(Collection<AlertRecord> alerts,
                                             Function<AlertRecord, Optional<String>> field) {
        return alerts.stream()
            .collect(Collectors.groupingBy(
                alert -> field.apply(alert).filter(value -> !value.isBlank()).orElse(UNKNOWN_BUCKET),
                LinkedHashMap::new,
                Collectors.counting()));
    }
    
    /**
     * The most frequent threat type, if any threats were reported
     */
    public Optional<String> topThreat(ThreatSummary summary) {
        return summary.getTopThreat().map(ThreatCount::getType);
    }
}
