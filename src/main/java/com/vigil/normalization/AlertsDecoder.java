package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.AlertRecord;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decodes {@code GET alerts} into a list of {@link AlertRecord}.
 * Accepts a bare array or an object wrapping it under {@code alerts}.
 */
@Component
public class AlertsDecoder implements PayloadDecoder {
    
    private static final Set<String> KNOWN_FIELDS = Set.of(
        "timestamp", "type", "severity", "message", "content");
    
    @Override
    public List<AlertRecord> decode(JsonNode body) throws PayloadParseException {
        JsonNode items = body != null && body.isObject() ? body.get("alerts") : body;
        JsonFields.requireArray(items, "alerts");
        
        List<AlertRecord> alerts = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            JsonFields.requireObject(item, "alert");
            alerts.add(new AlertRecord(
                JsonFields.optionalTimestamp(item, "timestamp"),
                JsonFields.optionalText(item, "type"),
                JsonFields.optionalText(item, "severity"),
                JsonFields.optionalText(item, "message", "content"),
                JsonFields.remaining(item, KNOWN_FIELDS)));
        }
        return List.copyOf(alerts);
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.ALERTS;
    }
}
