package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.SystemStatus;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

/**
 * Decodes {@code GET status}: {@code {status, uptime, last_update}}.
 */
@Component
public class StatusDecoder implements PayloadDecoder {
    
    @Override
    public SystemStatus decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireObject(body, "status");
        return new SystemStatus(
            JsonFields.requireText(body, "status"),
            JsonFields.optionalDouble(body, "uptime"),
            JsonFields.optionalTimestamp(body, "last_update"));
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.STATUS;
    }
}
