package com.architecture.memory.traceback.scheduler;

import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.dto.AreaAnalysisResult;
import com.architecture.memory.traceback.service.codeql.CodeGraphAnalysisService;
import com.architecture.memory.traceback.service.codeql.CodeSourceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically re-analyzes every area with CodeQL enabled. Unchanged sources hit the
 * database cache, so a refresh mostly re-runs queries and emission.
 * Disabled unless {@code traceback.codeql.refresh-cron} is set.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CodeGraphRefreshScheduler {

    private final CodeGraphAnalysisService analysisService;
    private final CodeSourceRegistry registry;
    private final SourceConfigResolver sourceConfigResolver;

    @Scheduled(cron = "${traceback.codeql.refresh-cron:-}")
    public void refreshCodeGraphs() {
        log.debug("Running code graph refresh...");
        for (String businessArea : sourceConfigResolver.businessAreas()) {
            if (!registry.isCodeQlEnabled(businessArea)) {
                continue;
            }
            try {
                AreaAnalysisResult result = analysisService.analyzeBusinessArea(businessArea);
                log.info("Code graph refresh of area={} finished: status={} sources={}",
                        businessArea, result.getStatus(), result.getSources().size());
            } catch (Exception e) {
                log.error("Code graph refresh of area={} failed: {}", businessArea, e.getMessage(), e);
            }
        }
    }
}
