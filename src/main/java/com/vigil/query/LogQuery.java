package com.vigil.query;

import com.vigil.domain.Severity;

import java.util.Objects;
import java.util.Optional;

/**
 * Filters and ordering for one log view request.
 * 
 * Filters compose as an AND: a case-insensitive text match against source,
 * content or type, and an exact severity match. Either may be absent.
 * The default query matches everything, newest first.
 */
public final class LogQuery {
    
    private static final LogQuery ALL = new LogQuery(null, null, LogSortField.TIMESTAMP, SortDirection.DESC);
    
    private final String text;
    private final Severity severity;
    private final LogSortField sortField;
    private final SortDirection direction;
    
    private LogQuery(String text, Severity severity, LogSortField sortField, SortDirection direction) {
        this.text = text == null || text.isBlank() ? null : text;
        this.severity = severity;
        this.sortField = Objects.requireNonNull(sortField, "sortField");
        this.direction = Objects.requireNonNull(direction, "direction");
    }
    
    public static LogQuery all() {
        return ALL;
    }
    
    public LogQuery withText(String text) {
        return new LogQuery(text, severity, sortField, direction);
    }
    
    public LogQuery withSeverity(Severity severity) {
        return new LogQuery(text, severity, sortField, direction);
    }
    
    public LogQuery sortedBy(LogSortField sortField, SortDirection direction) {
        return new LogQuery(text, severity, sortField, direction);
    }
    
    public Optional<String> getText() {
        return Optional.ofNullable(text);
    }
    
    public Optional<Severity> getSeverity() {
        return Optional.ofNullable(severity);
    }
    
    public LogSortField getSortField() {
        return sortField;
    }
    
    public SortDirection getDirection() {
        return direction;
    }
    
    @Override
    public String toString() {
        return "LogQuery{text=" + text + ", severity=" + severity
            + ", sort=" + sortField.getValue() + " " + direction.getValue() + "}";
    }
}
