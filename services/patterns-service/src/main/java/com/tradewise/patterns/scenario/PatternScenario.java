package com.tradewise.patterns.scenario;

import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;

/**
 * A fixed demo script and self-check for one design pattern, exposed under
 * {@code /api/patterns/{slug}}.
 */
public interface PatternScenario {

    /**
     * URL segment identifying the pattern, e.g. {@code chain-of-responsibility}
     */
    String slug();

    /**
     * Human-readable pattern name used in response envelopes
     */
    String patternName();

    PatternDemoResponse runDemo();

    PatternTestResponse runTest();
}
