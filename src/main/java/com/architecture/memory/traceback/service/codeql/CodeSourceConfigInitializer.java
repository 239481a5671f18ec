package com.architecture.memory.traceback.service.codeql;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Registers the repositories declared in each area's {@code codeql} source block on start-up.
 */
@Component
@ConditionalOnProperty(prefix = "traceback.codeql", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class CodeSourceConfigInitializer implements CommandLineRunner {

    private final CodeGraphAnalysisService analysisService;
    private final CodeQlCli codeQlCli;

    @Override
    public void run(String... args) {
        if (!codeQlCli.isAvailable()) {
            log.warn("[code-graph] CodeQL CLI not found, analyses will fail until it is installed");
        }
        log.info("[code-graph] Syncing code sources from configuration...");
        try {
            Map<String, List<String>> registered = analysisService.syncRegisteredSourcesFromConfig();
            log.info("[code-graph] Code sources synced for {} areas", registered.size());
        } catch (Exception e) {
            log.error("[code-graph] Code source sync failed: {}", e.getMessage(), e);
        }
    }
}
