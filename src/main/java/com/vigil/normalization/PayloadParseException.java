package com.vigil.normalization;

import com.vigil.source.SourceKind;

/**
 * Exception thrown when a source payload cannot be decoded.
 * Carries the source kind to help diagnose schema mismatches.
 */
public class PayloadParseException extends RuntimeException {
    
    private final SourceKind sourceKind;
    
    public PayloadParseException(String message) {
        super(message);
        this.sourceKind = null;
    }
    
    public PayloadParseException(String message, Throwable cause) {
        super(message, cause);
        this.sourceKind = null;
    }
    
    public PayloadParseException(String message, SourceKind sourceKind, Throwable cause) {
        super(message, cause);
        this.sourceKind = sourceKind;
    }
    
    public SourceKind getSourceKind() {
        return sourceKind;
    }
    
    @Override
    public String getMessage() {
        if (sourceKind == null) {
            return super.getMessage();
        }
        return super.getMessage() + " [Source: " + sourceKind.getValue() + "]";
    }
}
