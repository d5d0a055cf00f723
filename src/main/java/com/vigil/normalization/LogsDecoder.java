package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.domain.LogRecord;
import com.vigil.domain.Severity;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decodes {@code GET logs?window=} into classified {@link LogRecord}s.
 * 
 * A severity outside critical/high/medium/low is treated as absent and
 * classified from the content like any other unlabelled record.
 * Fields beyond the common shape are kept as record attributes.
 */
@Component
public class LogsDecoder implements PayloadDecoder {
    
    private static final Set<String> KNOWN_FIELDS = Set.of(
        "timestamp", "source", "content", "message", "severity", "type");
    
    private final LogClassifier classifier;
    
    public LogsDecoder(LogClassifier classifier) {
        this.classifier = classifier;
    }
    
    @Override
    public List<LogRecord> decode(JsonNode body) throws PayloadParseException {
        JsonFields.requireArray(body, "logs");
        List<LogRecord> records = new ArrayList<>(body.size());
        for (JsonNode item : body) {
            records.add(classifier.classify(decodeRecord(JsonFields.requireObject(item, "log record"))));
        }
        return List.copyOf(records);
    }
    
    private LogRecord decodeRecord(JsonNode item) {
        String content = JsonFields.optionalText(item, "content", "message");
        if (content == null) {
            throw new PayloadParseException("Missing required field: content");
        }
        return new LogRecord(
            JsonFields.requireTimestamp(item, "timestamp"),
            JsonFields.optionalText(item, "source"),
            content,
            Severity.parse(JsonFields.optionalText(item, "severity")).orElse(null),
            JsonFields.optionalText(item, "type"),
            JsonFields.remaining(item, KNOWN_FIELDS));
    }
    
    @Override
    public SourceKind getSourceKind() {
        return SourceKind.LOGS;
    }
}
