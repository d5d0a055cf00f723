package com.vigil.api;

import com.vigil.aggregation.Snapshot;
import com.vigil.domain.AlertRecord;
import com.vigil.domain.AnalyticsBundle;
import com.vigil.domain.AnalyticsTimeSeries;
import com.vigil.domain.LogRecord;
import com.vigil.domain.NetworkSample;
import com.vigil.query.LogQuery;
import com.vigil.query.LogQueryPipeline;
import com.vigil.query.LogView;
import com.vigil.query.TelemetryViews;
import com.vigil.source.SourceKind;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Builds API responses from a context's snapshot with the query pipeline
 */
@Component
public class ViewAssembler {
    
    private static final List<SourceKind> OVERVIEW_SOURCES = List.of(
        SourceKind.STATUS, SourceKind.THREAT_SUMMARY, SourceKind.METRICS,
        SourceKind.NETWORK, SourceKind.ALERT_SUMMARY, SourceKind.LOGS);
    
    private static final List<SourceKind> ANALYTICS_SOURCES = List.of(
        SourceKind.ANALYTICS, SourceKind.ALERTS, SourceKind.NETWORK, SourceKind.METRICS);
    
    private final LogQueryPipeline pipeline;
    private final TelemetryViews views;
    
    public ViewAssembler(LogQueryPipeline pipeline, TelemetryViews views) {
        this.pipeline = pipeline;
        this.views = views;
    }
    
    /**
     * Every slot of the snapshot, payloads included
     */
    public Map<String, SlotView> slots(Snapshot snapshot) {
        return slotViews(snapshot, List.of(SourceKind.values()), true);
    }
    
    public LogsResponse logs(Snapshot snapshot, LogQuery query) {
        List<LogRecord> logs = snapshot.getLogs().orElse(List.of());
        LogView view = pipeline.render(logs, query);
        return new LogsResponse(
            SlotView.of(snapshot.slot(SourceKind.LOGS), false),
            view,
            pipeline.countByType(view.getRecords()));
    }
    
    public OverviewResponse overview(Snapshot snapshot) {
        List<LogRecord> logs = snapshot.getLogs().orElse(List.of());
        return new OverviewResponse(
            snapshot.getStatus(),
            snapshot.getMetrics().flatMap(views::latest),
            snapshot.getNetwork().flatMap(views::latest),
            views.topProcesses(logs),
            snapshot.getAlertSummary(),
            snapshot.getThreatSummary(),
            snapshot.getThreatSummary().flatMap(views::topThreat),
            pipeline.countBySeverity(logs),
            slotViews(snapshot, OVERVIEW_SOURCES, false));
    }
    
    public AnalyticsResponse analytics(Snapshot snapshot, int windowSeconds) {
        Optional<AnalyticsBundle> bundle = snapshot.getAnalytics();
        List<AlertRecord> alerts = snapshot.getAlerts().orElse(List.of());
        List<NetworkSample> network = snapshot.getNetwork().orElse(List.of());
        return new AnalyticsResponse(
            windowSeconds,
            views.performanceSeries(bundle.map(AnalyticsBundle::getTimeSeries).orElse(AnalyticsTimeSeries.empty())),
            bundle.map(AnalyticsBundle::getProtocols).orElse(List.of()),
            bundle.map(AnalyticsBundle::getTopPorts).orElse(List.of()),
            bundle.map(b -> OptionalLong.of(b.getAlertsCount())).orElse(OptionalLong.empty()),
            bundle.map(b -> OptionalLong.of(b.getNetworkPacketsCount())).orElse(OptionalLong.empty()),
            bundle.map(b -> OptionalLong.of(b.getTotalLogEntries())).orElse(OptionalLong.empty()),
            views.alertCountsByType(alerts),
            views.alertCountsBySeverity(alerts),
            views.networkTraffic(network),
            slotViews(snapshot, ANALYTICS_SOURCES, false));
    }
    
    private static Map<String, SlotView> slotViews(Snapshot snapshot, List<SourceKind> kinds, boolean withPayload) {
        Map<String, SlotView> result = new LinkedHashMap<>();
        for (SourceKind kind : kinds) {
            result.put(kind.getValue(), SlotView.of(snapshot.slot(kind), withPayload));
        }
        return result;
    }
}
