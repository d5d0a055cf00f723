package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.CpuBreakdown;
import com.vigil.domain.LoadAverage;
import com.vigil.domain.MetricSample;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code GET metrics?window=} into an ordered list of {@link MetricSample}.
 * 
 * Accepts both the nested shape ({@code load: {1m, 5m, 15m}}, {@code cpu_breakdown: {...}})
 * and the flat shape the collector emits ({@code load_1m}, {@code cpu_user}, ...).
 * The batch is returned with strictly increasing timestamps.
 */
@Component
public class MetricsDecoder implements PayloadDecoder {
    
    @Override
    public List<MetricSample> decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireArray(body, "metrics");
        List<MetricSample> samples = new ArrayList<>(body.size());
        for (JsonNode item : body) {
            samples.add(decodeSample(JsonFields.requireObject(item, "metric sample")));
        }
        return TimeOrdering.strictlyIncreasing(samples, MetricSample::getTimestamp);
    }
    
    private MetricSample decodeSample(JsonNode item) {
        return MetricSample.builder(JsonFields.requireTimestamp(item, "timestamp"))
            .cpuPercent(JsonFields.optionalDouble(item, "cpu_percent"))
            .memoryPercent(JsonFields.optionalDouble(item, "memory_percent"))
            .load(decodeLoad(item))
            .swapPercent(JsonFields.optionalDouble(item, "swap_percent"))
            .diskPercent(JsonFields.optionalDouble(item, "disk_percent"))
            .processCount(JsonFields.optionalLong(item, "process_count", "processes"))
            .memoryUsedMb(JsonFields.optionalDouble(item, "memory_used_mb", "memory_used"))
            .memoryTotalMb(JsonFields.optionalDouble(item, "memory_total_mb", "memory_total"))
            .cpuBreakdown(decodeCpuBreakdown(item))
            .build();
    }
    
    private LoadAverage decodeLoad(JsonNode item) {
        Optional<JsonNode> load = JsonFields.field(item, "load");
        if (load.isPresent() && load.get().isObject()) {
            JsonNode nested = load.get();
            return new LoadAverage(
                JsonFields.optionalDouble(nested, "1m", "load_1m"),
                JsonFields.optionalDouble(nested, "5m", "load_5m"),
                JsonFields.optionalDouble(nested, "15m", "load_15m"));
        }
        
        // A bare number under "load" is the 1 minute average
        Double oneMinute = load.isPresent()
            ? JsonFields.optionalDouble(item, "load")
            : JsonFields.optionalDouble(item, "load_1m");
        Double fiveMinutes = JsonFields.optionalDouble(item, "load_5m");
        Double fifteenMinutes = JsonFields.optionalDouble(item, "load_15m");
        if (oneMinute == null && fiveMinutes == null && fifteenMinutes == null) {
            return null;
        }
        return new LoadAverage(oneMinute, fiveMinutes, fifteenMinutes);
    }
    
    private CpuBreakdown decodeCpuBreakdown(JsonNode item) {
        Optional<JsonNode> nested = JsonFields.field(item, "cpu_breakdown");
        if (nested.isPresent()) {
            JsonNode breakdown = JsonFields.requireObject(nested.get(), "cpu_breakdown");
            return new CpuBreakdown(
                JsonFields.optionalDouble(breakdown, "user"),
                JsonFields.optionalDouble(breakdown, "system"),
                JsonFields.optionalDouble(breakdown, "nice"),
                JsonFields.optionalDouble(breakdown, "io"),
                JsonFields.optionalDouble(breakdown, "softirq"),
                JsonFields.optionalDouble(breakdown, "iowait"));
        }
        
        Double user = JsonFields.optionalDouble(item, "cpu_user");
        Double system = JsonFields.optionalDouble(item, "cpu_system");
        Double nice = JsonFields.optionalDouble(item, "cpu_nice");
        Double io = JsonFields.optionalDouble(item, "cpu_io");
        Double softirq = JsonFields.optionalDouble(item, "cpu_softirq");
        Double iowait = JsonFields.optionalDouble(item, "cpu_iowait");
        if (user == null && system == null && nice == null && io == null && softirq == null && iowait == null) {
            return null;
        }
        return new CpuBreakdown(user, system, nice, io, softirq, iowait);
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.METRICS;
    }
}
