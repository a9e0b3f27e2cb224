package com.tradewise.patterns.dto;

/**
 * Catalog entry pointing at a pattern's demo and test endpoints.
 */
public record PatternSummary(String slug, String pattern, String demoPath, String testPath) {
}
