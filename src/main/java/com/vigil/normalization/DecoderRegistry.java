package com.vigil.normalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.source.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Registry of payload decoders by source kind.
 * Turns a raw response body into the payload type the snapshot slot expects.
 */
@Component
public class DecoderRegistry {
    
    private static final Logger log = LoggerFactory.getLogger(DecoderRegistry.class);
    
    private final Map<SourceKind, PayloadDecoder> decoders = new EnumMap<>(SourceKind.class);
    private final ObjectMapper objectMapper;
    
    public DecoderRegistry(List<PayloadDecoder> decoders, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        for (PayloadDecoder decoder : decoders) {
            PayloadDecoder previous = this.decoders.put(decoder.getSourceKind(), decoder);
            if (previous != null) {
                throw new IllegalStateException("Duplicate decoder for source " + decoder.getSourceKind().getValue());
            }
        }
        log.info("Registered payload decoders for sources: {}", this.decoders.keySet());
    }
    
    /**
     * Registry with every built-in decoder
     */
    public static DecoderRegistry withDefaults(LogClassifier classifier, ObjectMapper objectMapper) {
        return new DecoderRegistry(List.of(
            new StatusDecoder(),
            new ThreatSummaryDecoder(),
            new MetricsDecoder(),
            new NetworkDecoder(),
            new AlertSummaryDecoder(),
            new AlertsDecoder(),
            new LogsDecoder(classifier),
            new AnalyticsDecoder()), objectMapper);
    }
    
    /**
     * Gets the decoder for the specified source
     * 
     * @throws IllegalArgumentException if no decoder is registered
     */
    public PayloadDecoder getDecoder(SourceKind kind) {
        PayloadDecoder decoder = decoders.get(kind);
        if (decoder == null) {
            throw new IllegalArgumentException("No decoder registered for source " + kind.getValue());
        }
        return decoder;
    }
    
    /**
     * Parses and decodes a raw response body
     * 
     * @throws PayloadParseException if the body is empty, not JSON, or does not match the schema
     */
    public Object decode(SourceKind kind, String body) throws PayloadParseException {
        if (body == null || body.isBlank()) {
            throw new PayloadParseException("Empty response body", kind, null);
        }
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Malformed JSON: " + e.getOriginalMessage(), kind, e);
        }
        try {
            return getDecoder(kind).decode(tree);
        } catch (PayloadParseException e) {
            throw new PayloadParseException(e.getMessage(), kind, e);
        }
    }
}
