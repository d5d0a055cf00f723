package com.vigil.source;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Failure categories of a source fetch.
 */
public enum FetchErrorKind {
    
    /**
     * No response within the call's time bound
     */
    TIMEOUT("timeout"),
    
    /**
     * Connection-level failure (refused, reset, DNS)
     */
    UNREACHABLE("unreachable"),
    
    /**
     * Non-2xx status other than 401/403, or a body that does not match the expected schema
     */
    BAD_RESPONSE("bad_response"),
    
    /**
     * HTTP 401 or 403
     */
    UNAUTHORIZED("unauthorized");
    
    private final String value;
    
    FetchErrorKind(String value) {
        this.value = value;
    }
    
    @JsonValue
    public String getValue() {
        return value;
    }
}
