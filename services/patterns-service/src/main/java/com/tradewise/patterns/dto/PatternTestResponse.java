package com.tradewise.patterns.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Envelope returned by every {@code /test} endpoint. Status is PASS only when every check passed.
 */
@Value
@Builder
public class PatternTestResponse {

    public static final String PASS = "PASS";
    public static final String FAIL = "FAIL";

    String pattern;

    String status;

    List<TestCheck> checks;

    public static PatternTestResponse of(String pattern, List<TestCheck> checks) {
        boolean allPassed = checks.stream().allMatch(TestCheck::pass);
        return PatternTestResponse.builder()
                .pattern(pattern)
                .status(allPassed ? PASS : FAIL)
                .checks(List.copyOf(checks))
                .build();
    }
}
