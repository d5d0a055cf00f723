package com.vigil.aggregation;

import com.vigil.source.FetchResult;
import com.vigil.source.SourceKind;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holder of the current snapshot for one view context.
 * 
 * Readers always see a complete snapshot: merges build a new value and swap
 * it in atomically, never mutating the published one.
 */
public class SnapshotStore {
    
    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.empty());
    
    public Snapshot current() {
        return current.get();
    }
    
    /**
     * Merge a cycle's results into the current snapshot and publish the result
     */
    public Snapshot publish(Map<SourceKind, FetchResult> results) {
        return current.updateAndGet(snapshot -> snapshot.merge(results));
    }
}
