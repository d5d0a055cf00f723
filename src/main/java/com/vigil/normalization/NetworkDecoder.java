package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.NetworkSample;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes {@code GET network?window=} into an ordered list of {@link NetworkSample}.
 */
@Component
public class NetworkDecoder implements PayloadDecoder {
    
    @Override
    public List<NetworkSample> decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireArray(body, "network");
        List<NetworkSample> samples = new ArrayList<>(body.size());
        for (JsonNode item : body) {
            JsonFields.requireObject(item, "network sample");
            samples.add(new NetworkSample(
                JsonFields.requireTimestamp(item, "timestamp"),
                JsonFields.optionalDouble(item, "incoming_mbps"),
                JsonFields.optionalDouble(item, "outgoing_kbps"),
                JsonFields.optionalDouble(item, "total_incoming_gb"),
                JsonFields.optionalDouble(item, "total_outgoing_mb"),
                JsonFields.optionalDouble(item, "packet_loss_mb")));
        }
        return TimeOrdering.strictlyIncreasing(samples, NetworkSample::getTimestamp);
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.NETWORK;
    }
}
