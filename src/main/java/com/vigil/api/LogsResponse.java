package com.vigil.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.vigil.query.LogView;

import java.util.Map;

/**
 * The log view together with the state of the log slot it was computed from
 */
public class LogsResponse {
    
    @JsonProperty("source")
    private final SlotView source;
    
    @JsonUnwrapped
    private final LogView view;
    
    @JsonProperty("type_counts")
    private final Map<String, Long> typeCounts;
    
    public LogsResponse(SlotView source, LogView view, Map<String, Long> typeCounts) {
        this.source = source;
        this.view = view;
        this.typeCounts = typeCounts;
    }
    
    public SlotView getSource() {
        return source;
    }
    
    public LogView getView() {
        return view;
    }
    
    public Map<String, Long> getTypeCounts() {
        return typeCounts;
    }
}
