package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.ThreatCount;
import com.vigil.domain.ThreatSummary;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Decodes {@code GET threats/summary}.
 * {@code top_threats} is re-sorted by count, highest first; ties keep the source order.
 */
@Component
public class ThreatSummaryDecoder implements PayloadDecoder {
    
    @Override
    public ThreatSummary decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireObject(body, "threat summary");
        return new ThreatSummary(
            JsonFields.requireLong(body, "total_alerts"),
            JsonFields.optionalLong(body, "alerts_last_hour"),
            JsonFields.optionalLong(body, "alerts_last_day"),
            JsonFields.counts(body, "severity_counts"),
            decodeTopThreats(body));
    }
    
    private List<ThreatCount> decodeTopThreats(JsonNode body) {
        List<ThreatCount> threats = new ArrayList<>();
        Optional<JsonNode> field = JsonFields.field(body, "top_threats");
        if (field.isEmpty()) {
            return threats;
        }
        for (JsonNode item : JsonFields.requireArray(field.get(), "top_threats")) {
            JsonFields.requireObject(item, "top threat");
            threats.add(new ThreatCount(
                JsonFields.requireText(item, "type"),
                JsonFields.requireLong(item, "count")));
        }
        threats.sort(Comparator.comparingLong(ThreatCount::getCount).reversed());
        return threats;
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.THREAT_SUMMARY;
    }
}
