package com.vigil;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Vigil telemetry engine.
 * 
 * Vigil keeps the near-real-time state behind the IDS dashboard: it polls the
 * telemetry sources (status, metrics, network, alerts, logs, analytics) on
 * independent cadences, tolerates partial failures, normalizes log records and
 * serves filtered and sorted views over the latest snapshot.
 * 
 * Key Features:
 * - Concurrent per-source polling with individual time bounds
 * - Stale-but-valid snapshots (a failed fetch never erases data)
 * - Deterministic severity/type classification of raw log records
 * - Per-view refresh schedulers that never overlap cycles
 * 
 * @author Vigil Team
 * @version 1.0.0
 */
@SpringBootApplication
public class VigilApplication {

    /**
     * Main entry point for the Vigil telemetry engine.
     * 
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(VigilApplication.class, args);
    }
}
