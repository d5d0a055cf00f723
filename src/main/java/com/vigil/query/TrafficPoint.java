package com.vigil.query;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Network throughput at one instant, both directions in Mbps
 */
public final class TrafficPoint {
    
    private final Instant timestamp;
    private final OptionalDouble inboundMbps;
    private final OptionalDouble outboundMbps;
    
    public TrafficPoint(Instant timestamp, OptionalDouble inboundMbps, OptionalDouble outboundMbps) {
        this.timestamp = timestamp;
        this.inboundMbps = inboundMbps;
        this.outboundMbps = outboundMbps;
    }
    
    @JsonProperty("timestamp")
    public Instant getTimestamp() {
        return timestamp;
    }
    
    @JsonProperty("inbound_mbps")
    public OptionalDouble getInboundMbps() {
        return inboundMbps;
    }
    
    @JsonProperty("outbound_mbps")
    public OptionalDouble getOutboundMbps() {
        return outboundMbps;
    }
}
