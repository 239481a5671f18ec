package com.architecture.memory.traceback.controller;

import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.dto.IngestionResult;
import com.architecture.memory.traceback.exception.InvalidBusinessAreaException;
import com.architecture.memory.traceback.service.ingestion.IngestionService;
import com.architecture.memory.traceback.service.ingestion.SyncMode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

@RestController
@RequestMapping("/api/areas/{area}")
@RequiredArgsConstructor
@Slf4j
public class IngestionController {

    private final IngestionService ingestionService;
    private final SourceConfigResolver sourceConfigResolver;

    /**
     * POST /api/areas/{area}/ingest?mode=incremental
     */
    @PostMapping("/ingest")
    public ResponseEntity<Map<String, IngestionResult>> ingest(@PathVariable String area,
                                                               @RequestParam(defaultValue = "incremental") String mode) {
        if (!sourceConfigResolver.isKnownArea(area)) {
            throw new InvalidBusinessAreaException(area, sourceConfigResolver.businessAreas());
        }
        SyncMode syncMode = SyncMode.valueOf(mode.toUpperCase(Locale.ROOT));
        log.info("[Ingestion Controller] Ingesting area={} mode={}", area, syncMode);
        return ResponseEntity.ok(ingestionService.ingestAllSources(area.toLowerCase(Locale.ROOT), syncMode));
    }
}
