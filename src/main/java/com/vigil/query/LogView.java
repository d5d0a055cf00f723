package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.vigil.domain.LogRecord;

import java.util.List;
import java.util.Map;

/**
 * An ordered, filtered log view with its summary counts.
 */
public final class LogView {
    
    private final List<LogRecord> records;
    private final int total;
    private final Map<String, Long> severityCounts;
    
    public LogView(List<LogRecord> records, int total, Map<String, Long> severityCounts) {
        this.records = List.copyOf(records);
        this.total = total;
        this.severityCounts = severityCounts;
    }
    
    @JsonProperty("records")
    public List<LogRecord> getRecords() {
        return records;
    }
    
    /**
     * Records in the snapshot before filtering
     */
    @JsonProperty("total")
    public int getTotal() {
        return total;
    }
    
    @JsonProperty("matched")
    public int getMatched() {
        return records.size();
    }
    
    /**
     * Severity counts over the matched records
     */
    @JsonProperty("severity_counts")
    public Map<String, Long> getSeverityCounts() {
        return severityCounts;
    }
}
