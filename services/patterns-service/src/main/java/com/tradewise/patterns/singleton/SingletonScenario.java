package com.tradewise.patterns.singleton;

import com.tradewise.patterns.dto.PatternDemoResponse;
import com.tradewise.patterns.dto.PatternTestResponse;
import com.tradewise.patterns.dto.TestCheck;
import com.tradewise.patterns.scenario.PatternScenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SingletonScenario implements PatternScenario {

    private static final String API_URL_KEY = "TradingApiUrl";

    private final ConfigurationService configurationService;

    @Override
    public String slug() {
        return "singleton";
    }

    @Override
    public String patternName() {
        return "Singleton";
    }

    @Override
    public PatternDemoResponse runDemo() {
        List<ConfigCall> calls = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String value = configurationService.getValue(API_URL_KEY);
            calls.add(new ConfigCall(i + 1, configurationService.getInstanceId(), value,
                configurationService.getAccessCount()));
        }

        return PatternDemoResponse.builder()
            .pattern(patternName())
            .description("Demonstrates singleton pattern: same instance ID across multiple calls, shared state (access count).")
            .result(new SingletonDemo(configurationService.getInstanceId(), calls,
                "Each pod of a multi-instance deployment holds its own instance. "
                    + "Cross-instance coordination needs database constraints, optimistic concurrency or distributed locks."))
            .metadata(Map.of(
                "ThreadSafe", true,
                "ScalabilityNote", "Singleton per instance only; not suitable for distributed coordination"))
            .build();
    }

    @Override
    public PatternTestResponse runTest() {
        List<TestCheck> checks = new ArrayList<>();

        String first = configurationService.getInstanceId();
        String second = configurationService.getInstanceId();
        checks.add(new TestCheck("Instance ID Consistency", first.equals(second),
            "Instance IDs match: " + first));

        int before = configurationService.getAccessCount();
        configurationService.getValue("TestKey");
        int after = configurationService.getAccessCount();
        checks.add(new TestCheck("Access Count Increment", after > before,
            String.format("Access count increased from %d to %d", before, after)));

        String apiUrl = configurationService.getValue(API_URL_KEY);
        checks.add(new TestCheck("Configuration Access", !apiUrl.isEmpty(),
            "Retrieved config value: " + apiUrl));

        return PatternTestResponse.of(patternName(), checks);
    }

    public record ConfigCall(int call, String instanceId, String configValue, int accessCount) {
    }

    public record SingletonDemo(String instanceId, List<ConfigCall> calls, String note) {
    }
}
