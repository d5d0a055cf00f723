package com.vigil.domain;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One network traffic sample from the network source.
 * Units follow the source: inbound rate in Mbps, outbound rate in kbps.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public final class NetworkSample {
    
    private final Instant timestamp;
    private final Double incomingMbps;
    private final Double outgoingKbps;
    private final Double totalIncomingGb;
    private final Double totalOutgoingMb;
    private final Double packetLossMb;
    
    public NetworkSample(Instant timestamp, Double incomingMbps, Double outgoingKbps,
                         Double totalIncomingGb, Double totalOutgoingMb, Double packetLossMb) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.incomingMbps = incomingMbps;
        this.outgoingKbps = outgoingKbps;
        this.totalIncomingGb = totalIncomingGb;
        this.totalOutgoingMb = totalOutgoingMb;
        this.packetLossMb = packetLossMb;
    }
    
    public Instant getTimestamp() {
        return timestamp;
    }
    
    public OptionalDouble getIncomingMbps() {
        return of(incomingMbps);
    }
    
    public OptionalDouble getOutgoingKbps() {
        return of(outgoingKbps);
    }
    
    /**
     * Outbound rate converted to Mbps
     */
    public OptionalDouble getOutgoingMbps() {
        return outgoingKbps != null ? OptionalDouble.of(outgoingKbps / 1000.0) : OptionalDouble.empty();
    }
    
    public OptionalDouble getTotalIncomingGb() {
        return of(totalIncomingGb);
    }
    
    public OptionalDouble getTotalOutgoingMb() {
        return of(totalOutgoingMb);
    }
    
    public OptionalDouble getPacketLossMb() {
        return of(packetLossMb);
    }
    
    private static OptionalDouble of(Double value) {
        return value != null ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
