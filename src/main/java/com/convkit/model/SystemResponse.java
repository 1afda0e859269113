package com.convkit.model;

import com.convkit.codec.RecordSchema;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Service-owned dialog state inside the {@link Context}. Its keys are not fixed, so the whole
 * object lives in the extension bag and must be sent back unchanged.
 */
public record SystemResponse(Map<String, JsonNode> additionalProperties) {

    public static final RecordSchema<SystemResponse> SCHEMA = RecordSchema.builder(SystemResponse.class)
            .extensions(SystemResponse::additionalProperties)
            .build(v -> new SystemResponse(v.extensions()));

    public SystemResponse {
        additionalProperties = ModelSupport.bag(additionalProperties);
    }

    public SystemResponse() {
        this(Map.of());
    }
}
