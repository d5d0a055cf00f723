package com.vigil.api;

import com.vigil.domain.Severity;
import com.vigil.query.LogQuery;
import com.vigil.query.LogSortField;
import com.vigil.query.SortDirection;
import com.vigil.query.WindowPreset;
import com.vigil.scheduling.ContextRefresher;
import com.vigil.scheduling.RefreshCoordinator;
import com.vigil.scheduling.ViewContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Read and control API over the per-context snapshots.
 * 
 * Reads never trigger fetches; they derive views from the latest published
 * snapshot. Context names are {@code overview}, {@code logs} and {@code analytics}.
 */
@RestController
@RequestMapping("/api/telemetry")
public class TelemetryController {
    
    private final RefreshCoordinator coordinator;
    private final ViewAssembler assembler;
    
    public TelemetryController(RefreshCoordinator coordinator, ViewAssembler assembler) {
        this.coordinator = coordinator;
        this.assembler = assembler;
    }
    
    @GetMapping("/contexts/{context}/snapshot")
    public SnapshotResponse snapshot(@PathVariable String context) {
        ContextRefresher refresher = coordinator.refresher(ViewContext.fromValue(context));
        return new SnapshotResponse(
            refresher.getContext(),
            refresher.getState(),
            refresher.getWindowSeconds(),
            assembler.slots(refresher.getStore().current()));
    }
    
    @PostMapping("/contexts/{context}/refresh")
    public ResponseEntity<RefreshResponse> refresh(@PathVariable String context) {
        ViewContext viewContext = ViewContext.fromValue(context);
        boolean started = coordinator.refresh(viewContext);
        return accepted(viewContext, started);
    }
    
    /**
     * Change the query window, by seconds or by preset name (hour, 6h, day, week)
     */
    @PutMapping("/contexts/{context}/window")
    public ResponseEntity<RefreshResponse> changeWindow(
            @PathVariable String context,
            @RequestParam(required = false) Integer seconds,
            @RequestParam(required = false) String preset) {
        ViewContext viewContext = ViewContext.fromValue(context);
        int window;
        if (seconds != null) {
            window = seconds;
        } else if (preset != null) {
            window = WindowPreset.fromValue(preset).getSeconds();
        } else {
            throw new IllegalArgumentException("Either seconds or preset is required");
        }
        boolean started = coordinator.changeWindow(viewContext, window);
        return accepted(viewContext, started);
    }
    
    @GetMapping("/logs")
    public LogsResponse logs(
            @RequestParam(required = false) String text,
            @RequestParam(required = false) String severity,
            @RequestParam(defaultValue = "timestamp") String sort,
            @RequestParam(defaultValue = "desc") String direction) {
        LogQuery query = LogQuery.all()
            .withText(text)
            .withSeverity(severity == null || severity.isBlank() ? null : Severity.fromValue(severity))
            .sortedBy(LogSortField.fromValue(sort), SortDirection.fromValue(direction));
        return assembler.logs(coordinator.snapshot(ViewContext.LOGS), query);
    }
    
    @GetMapping("/overview")
    public OverviewResponse overview() {
        return assembler.overview(coordinator.snapshot(ViewContext.OVERVIEW));
    }
    
    @GetMapping("/analytics")
    public AnalyticsResponse analytics() {
        ContextRefresher refresher = coordinator.refresher(ViewContext.ANALYTICS);
        return assembler.analytics(refresher.getStore().current(), refresher.getWindowSeconds());
    }
    
    private ResponseEntity<RefreshResponse> accepted(ViewContext context, boolean started) {
        RefreshResponse body = new RefreshResponse(context, started,
            coordinator.refresher(context).getWindowSeconds());
        return ResponseEntity.status(started ? HttpStatus.ACCEPTED : HttpStatus.OK).body(body);
    }
}
