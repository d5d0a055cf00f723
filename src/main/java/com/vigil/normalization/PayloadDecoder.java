package com.vigil.normalization;

import com.fasterxml.jackson.databind.JsonNode;
import com.vigil.source.SourceKind;

/**
 * Interface for decoding the JSON body of one source endpoint into domain objects.
 * This is the normalization boundary: absent fields become absent values here,
 * never magic defaults further down.
 */
public interface PayloadDecoder {
    
    /**
     * Decodes a parsed JSON body
     * 
     * @param body the response body
     * @return payload of the type declared by {@link SourceKind#getPayloadType()}
     * @throws PayloadParseException if the body does not match the expected schema
     */
    Object decode(JsonNode body) throws PayloadParseException;
    
    /**
     * Returns the source this decoder handles
     */
    SourceKind getSourceKind();
}
