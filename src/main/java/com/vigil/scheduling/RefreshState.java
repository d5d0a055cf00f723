package com.vigil.scheduling;

/**
 * Refresh state of one view context
 */
public enum RefreshState {
    
    IDLE,
    
    /**
     * A cycle is in flight; further ticks are skipped until it completes
     */
    FETCHING
}
