package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single log line reported by the logs source.
 * 
 * Severity and type are optional on ingestion; the classifier fills them in
 * during normalization. Instances are immutable: classification produces a
 * new record.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public final class LogRecord {
    
    public static final String TYPE_INTRUSION = "intrusion";
    public static final String TYPE_AUTHENTICATION = "authentication";
    public static final String TYPE_FIREWALL = "firewall";
    public static final String TYPE_SYSTEM = "system";
    public static final String TYPE_PROCESS = "process";
    
    private final Instant timestamp;
    private final String source;
    private final String content;
    private final Severity severity;
    private final String type;
    
    /**
     * Any extra fields of the record (e.g. process_name, cpu_percent for process records)
     */
    private final Map<String, Object> attributes;
    
    public LogRecord(Instant timestamp, String source, String content) {
        this(timestamp, source, content, null, null, Map.of());
    }
    
    public LogRecord(Instant timestamp, String source, String content,
                     Severity severity, String type, Map<String, Object> attributes) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.source = source != null ? source : "";
        this.content = content != null ? content : "";
        this.severity = severity;
        this.type = type == null || type.isBlank() ? null : type;
        this.attributes = attributes == null || attributes.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
    
    public LogRecord withSeverity(Severity severity) {
        return new LogRecord(timestamp, source, content, severity, type, attributes);
    }
    
    public LogRecord withType(String type) {
        return new LogRecord(timestamp, source, content, severity, type, attributes);
    }
    
    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }
    
    @JsonProperty("source")
    public String getSource() {
        return source;
    }
    
    @JsonProperty("content")
    public String getContent() {
        return content;
    }
    
    @JsonProperty("severity")
    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }
    
    @JsonProperty("type")
    public Optional<String> getType() {
        return Optional.ofNullable(type);
    }
    
    @JsonProperty("attributes")
    public Map<String, Object> getAttributes() {
        return attributes;
    }
    
    public Optional<Object> getAttribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogRecord)) {
            return false;
        }
        LogRecord other = (LogRecord) o;
        return timestamp.equals(other.timestamp)
            && source.equals(other.source)
            && content.equals(other.content)
            && severity == other.severity
            && Objects.equals(type, other.type)
            && attributes.equals(other.attributes);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(timestamp, source, content, severity, type, attributes);
    }
    
    @Override
    public String toString() {
        return "LogRecord{timestamp=" + timestamp + ", source='" + source + "', severity=" + severity
            + ", type=" + type + ", content='" + content + "'}";
    }
}
