package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.AnalyticsBundle;
import com.vigil.domain.AnalyticsTimeSeries;
import com.vigil.domain.PortCount;
import com.vigil.domain.ProtocolShare;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code GET analytics}: time series, protocol and port breakdowns, counters.
 */
@Component
public class AnalyticsDecoder implements PayloadDecoder {
    
    private static final int MAX_PORT = 65535;
    
    @Override
    public AnalyticsBundle decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireObject(body, "analytics");
        
        AnalyticsTimeSeries timeSeries = JsonFields.field(body, "time_series")
            .map(this::decodeTimeSeries)
            .orElseGet(AnalyticsTimeSeries::empty);
        
        List<ProtocolShare> protocols = new ArrayList<>();
        List<PortCount> topPorts = new ArrayList<>();
        Optional<JsonNode> network = JsonFields.field(body, "network");
        if (network.isPresent()) {
            JsonNode node = JsonFields.requireObject(network.get(), "network");
            JsonFields.field(node, "protocols").ifPresent(items -> {
                for (JsonNode item : JsonFields.requireArray(items, "protocols")) {
                    protocols.add(new ProtocolShare(
                        JsonFields.requireText(item, "name"),
                        JsonFields.requireDouble(item, "value")));
                }
            });
            JsonFields.field(node, "top_ports").ifPresent(items -> {
                for (JsonNode item : JsonFields.requireArray(items, "top_ports")) {
                    topPorts.add(new PortCount(
                        requirePort(item),
                        JsonFields.requireLong(item, "count")));
                }
            });
        }
        
        return new AnalyticsBundle(
            timeSeries,
            protocols,
            topPorts,
            JsonFields.requireLong(body, "alerts_count"),
            JsonFields.requireLong(body, "network_packets_count"),
            JsonFields.requireLong(body, "total_log_entries"));
    }
    
    private static int requirePort(JsonNode item) {
        long port = JsonFields.requireLong(item, "port");
        if (port < 0 || port > MAX_PORT) {
            throw new PayloadParseException("Port out of range: " + port);
        }
        return (int) port;
    }
    
    private AnalyticsTimeSeries decodeTimeSeries(JsonNode node) {
        JsonFields.requireObject(node, "time_series");
        List<Instant> timestamps = new ArrayList<>();
        JsonFields.field(node, "timestamps").ifPresent(items -> {
            for (JsonNode item : JsonFields.requireArray(items, "timestamps")) {
                timestamps.add(JsonFields.toInstant(item));
            }
        });
        return new AnalyticsTimeSeries(
            timestamps,
            JsonFields.doubles(node, "cpu"),
            JsonFields.doubles(node, "memory"));
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.ANALYTICS;
    }
}
