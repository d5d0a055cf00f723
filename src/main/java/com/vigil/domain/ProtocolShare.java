package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Share of observed traffic for one network protocol.
 */
public final class ProtocolShare {
    
    private final String name;
    private final double value;
    
    public ProtocolShare(String name, double value) {
        this.name = name;
        this.value = value;
    }
    
    @JsonProperty("name")
    public String getName() {
        return name;
    }
    
    @JsonProperty("value")
    public double getValue() {
        return value;
    }
}
