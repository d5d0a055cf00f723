package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.AlertSummary;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

/**
 * Decodes {@code GET alerts/summary}: {@code {total_alerts, by_type, by_severity}}.
 */
@Component
public class AlertSummaryDecoder implements PayloadDecoder {
    
    @Override
    public AlertSummary decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireObject(body, "alert summary");
        return new AlertSummary(
            JsonFields.requireLong(body, "total_alerts"),
            JsonFields.counts(body, "by_type"),
            JsonFields.counts(body, "by_severity"));
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.ALERT_SUMMARY;
    }
}
