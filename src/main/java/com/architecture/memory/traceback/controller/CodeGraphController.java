package com.architecture.memory.traceback.controller;

import com.architecture.memory.traceback.dto.AreaAnalysisResult;
import com.architecture.memory.traceback.dto.CodeSourceRequest;
import com.architecture.memory.traceback.dto.SourceAnalysisResult;
import com.architecture.memory.traceback.exception.SourceNotFoundException;
import com.architecture.memory.traceback.model.CodeSource;
import com.architecture.memory.traceback.service.codeql.CodeGraphAnalysisService;
import com.architecture.memory.traceback.service.codeql.CodeSourceRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Code source registration and code graph analysis.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class CodeGraphController {

    private final CodeSourceRegistry registry;
    private final CodeGraphAnalysisService analysisService;

    @PostMapping("/areas/{area}/code-sources")
    public ResponseEntity<CodeSource> register(@PathVariable String area, @Valid @RequestBody CodeSourceRequest request) {
        log.info("[Code Graph Controller] Registering {} source {} in area={}", request.getSourceType(), request.getPath(), area);
        if (!CodeSource.TYPE_GITLAB.equals(request.getSourceType()) && !CodeSource.TYPE_FILESYSTEM.equals(request.getSourceType())) {
            throw new IllegalArgumentException("Unsupported source type: " + request.getSourceType());
        }

        String sourceId = registry.register(area, request.getSourceType(), request.getPath(), request.getLanguages(),
                request.getName(), request.getSourceId(), request.isEnabled(), request.getMetadata());
        CodeSource source = registry.get(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
        return ResponseEntity.status(HttpStatus.CREATED).body(source);
    }

    @GetMapping("/areas/{area}/code-sources")
    public ResponseEntity<List<CodeSource>> list(@PathVariable String area,
                                                 @RequestParam(required = false) String type,
                                                 @RequestParam(defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(registry.listSources(area, type, enabledOnly));
    }

    @GetMapping("/code-sources/{sourceId}")
    public ResponseEntity<CodeSource> get(@PathVariable String sourceId) {
        return ResponseEntity.ok(registry.get(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId)));
    }

    @DeleteMapping("/code-sources/{sourceId}")
    public ResponseEntity<Void> delete(@PathVariable String sourceId) {
        log.info("[Code Graph Controller] Removing source {}", sourceId);
        analysisService.removeSource(sourceId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Runs synchronously by default; {@code async=true} queues the analysis and returns 202.
     */
    @PostMapping("/code-sources/{sourceId}/analyze")
    public ResponseEntity<?> analyzeSource(@PathVariable String sourceId,
                                           @RequestParam(defaultValue = "false") boolean async) {
        if (async) {
            registry.get(sourceId).orElseThrow(() -> new SourceNotFoundException(sourceId));
            analysisService.analyzeSourceAsync(sourceId);
            return ResponseEntity.accepted().body(Map.of("sourceId", sourceId, "status", "queued"));
        }
        SourceAnalysisResult result = analysisService.analyzeSource(sourceId);
        return ResponseEntity.ok(result);
    }

    @PostMapping("/code-sources/{sourceId}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable String sourceId) {
        boolean cancelled = analysisService.cancelAnalysis(sourceId);
        return ResponseEntity.ok(Map.of("sourceId", sourceId, "cancelled", cancelled));
    }

    @PostMapping("/areas/{area}/code-graph/analyze")
    public ResponseEntity<AreaAnalysisResult> analyzeArea(@PathVariable String area) {
        return ResponseEntity.ok(analysisService.analyzeBusinessArea(area));
    }

    @PostMapping("/code-sources/sync")
    public ResponseEntity<Map<String, List<String>>> syncFromConfig() {
        return ResponseEntity.ok(analysisService.syncRegisteredSourcesFromConfig());
    }
}
