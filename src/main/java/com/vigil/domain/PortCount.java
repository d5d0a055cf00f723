package com.vigil.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Hit count for one destination port.
 */
public final class PortCount {
    
    private final int port;
    private final long count;
    
    public PortCount(int port, long count) {
        this.port = port;
        this.count = count;
    }
    
    @JsonProperty("port")
    public int getPort() {
        return port;
    }
    
    @JsonProperty("count")
    public long getCount() {
        return count;
    }
}
