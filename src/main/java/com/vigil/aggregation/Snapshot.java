package com.vigil.aggregation;

import com.vigil.domain.AlertRecord;
import com.vigil.domain.AlertSummary;
import com.vigil.domain.AnalyticsBundle;
import com.vigil.domain.LogRecord;
import com.vigil.domain.MetricSample;
import com.vigil.domain.NetworkSample;
import com.vigil.domain.SystemStatus;
import com.vigil.domain.ThreatSummary;
import com.vigil.source.FetchError;
import com.vigil.source.FetchErrorKind;
import com.vigil.source.FetchResult;
import com.vigil.source.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Latest merged state across all sources, one {@link Slot} per {@link SourceKind}.
 * 
 * A snapshot is an immutable value. {@link #merge(Map)} builds a new snapshot
 * from the results of one refresh cycle; publishing it is the caller's job.
 */
public final class Snapshot {
    
    private static final Logger log = LoggerFactory.getLogger(Snapshot.class);
    
    private static final Snapshot EMPTY = new Snapshot(new EnumMap<>(SourceKind.class));
    
    private final Map<SourceKind, Slot> slots;
    
    private Snapshot(EnumMap<SourceKind, Slot> slots) {
        this.slots = Collections.unmodifiableMap(slots);
    }
    
    public static Snapshot empty() {
        return EMPTY;
    }
    
    public Slot slot(SourceKind kind) {
        return slots.getOrDefault(kind, Slot.unpopulated());
    }
    
    /**
     * Every source kind with its slot, unpopulated ones included
     */
    public Map<SourceKind, Slot> getSlots() {
        EnumMap<SourceKind, Slot> all = new EnumMap<>(SourceKind.class);
        for (SourceKind kind : SourceKind.values()) {
            all.put(kind, slot(kind));
        }
        return all;
    }
    
    /**
     * Apply the results of one refresh cycle.
     * 
     * Successful results overwrite their slot's payload; failed results only
     * annotate the slot. Sources absent from {@code results} are left untouched.
     * A successful result whose payload is not of the source's payload type is
     * treated as a BAD_RESPONSE failure.
     * 
     * @return a new snapshot; this one is unchanged
     */
    public Snapshot merge(Map<SourceKind, FetchResult> results) {
        if (results.isEmpty()) {
            return this;
        }
        EnumMap<SourceKind, Slot> next = slots.isEmpty()
            ? new EnumMap<>(SourceKind.class)
            : new EnumMap<>(slots);
        results.forEach((kind, result) -> next.put(kind, apply(kind, slot(kind), result)));
        return new Snapshot(next);
    }
    
    private static Slot apply(SourceKind kind, Slot slot, FetchResult result) {
        if (!result.isSuccess()) {
            return slot.withFailure(result.getError().get());
        }
        Object payload = result.getPayload().get();
        Instant fetchedAt = result.getFetchedAt().get();
        if (!kind.getPayloadType().isInstance(payload)) {
            log.warn("Discarding {} payload of unexpected type {}", kind.getValue(), payload.getClass().getName());
            return slot.withFailure(new FetchError(FetchErrorKind.BAD_RESPONSE,
                "Unexpected payload type " + payload.getClass().getSimpleName(), fetchedAt));
        }
        return slot.withSuccess(payload, fetchedAt);
    }
    
    public Optional<SystemStatus> getStatus() {
        return slot(SourceKind.STATUS).getPayload(SystemStatus.class);
    }
    
    public Optional<ThreatSummary> getThreatSummary() {
        return slot(SourceKind.THREAT_SUMMARY).getPayload(ThreatSummary.class);
    }
    
    public Optional<AlertSummary> getAlertSummary() {
        return slot(SourceKind.ALERT_SUMMARY).getPayload(AlertSummary.class);
    }
    
    public Optional<AnalyticsBundle> getAnalytics() {
        return slot(SourceKind.ANALYTICS).getPayload(AnalyticsBundle.class);
    }
    
    public Optional<List<MetricSample>> getMetrics() {
        return listPayload(SourceKind.METRICS);
    }
    
    public Optional<List<NetworkSample>> getNetwork() {
        return listPayload(SourceKind.NETWORK);
    }
    
    public Optional<List<LogRecord>> getLogs() {
        return listPayload(SourceKind.LOGS);
    }
    
    public Optional<List<AlertRecord>> getAlerts() {
        return listPayload(SourceKind.ALERTS);
    }
    
    // List slots are only ever filled by their decoder, so the element type is known
    @SuppressWarnings("unchecked")
    private <T> Optional<List<T>> listPayload(SourceKind kind) {
        return slot(kind).getPayload(List.class).map(list -> (List<T>) list);
    }
    
    @Override
    public String toString() {
        return "Snapshot" + slots;
    }
}
