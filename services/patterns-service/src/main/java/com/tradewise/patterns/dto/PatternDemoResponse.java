package com.tradewise.patterns.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Envelope returned by every {@code /demo} endpoint
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatternDemoResponse {

    String pattern;

    String description;

    /**
     * Scenario-specific payload
     */
    Object result;

    Map<String, Object> metadata;
}
