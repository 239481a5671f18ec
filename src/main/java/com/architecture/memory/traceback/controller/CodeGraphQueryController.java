package com.architecture.memory.traceback.controller;

import com.architecture.memory.traceback.config.SourceConfigResolver;
import com.architecture.memory.traceback.exception.InvalidBusinessAreaException;
import com.architecture.memory.traceback.model.graph.FunctionNode;
import com.architecture.memory.traceback.service.retrieval.GraphRetriever;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

/**
 * Call graph lookups over the emitted code graph of a business area.
 */
@RestController
@RequestMapping("/api/areas/{area}/code-graph")
@ConditionalOnProperty(prefix = "traceback.codeql", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class CodeGraphQueryController {

    private final GraphRetriever graphRetriever;
    private final SourceConfigResolver sourceConfigResolver;

    @GetMapping("/functions/{name}/callers")
    public ResponseEntity<List<FunctionNode>> callers(@PathVariable String area, @PathVariable String name,
                                                      @RequestParam(defaultValue = "20") int limit) {
        String businessArea = requireArea(area);
        log.info("[Code Graph Query Controller] Callers of {} in area={}", name, businessArea);
        return ResponseEntity.ok(graphRetriever.getCallers(name, businessArea, limit));
    }

    @GetMapping("/functions/{name}/callees")
    public ResponseEntity<List<FunctionNode>> callees(@PathVariable String area, @PathVariable String name,
                                                      @RequestParam(defaultValue = "20") int limit) {
        String businessArea = requireArea(area);
        log.info("[Code Graph Query Controller] Callees of {} in area={}", name, businessArea);
        return ResponseEntity.ok(graphRetriever.getCallees(name, businessArea, limit));
    }

    /**
     * Script paths carry slashes, so they travel as a query parameter.
     */
    @GetMapping("/scripts/callers")
    public ResponseEntity<List<FunctionNode>> scriptCallers(@PathVariable String area, @RequestParam String path,
                                                            @RequestParam(defaultValue = "20") int limit) {
        String businessArea = requireArea(area);
        log.info("[Code Graph Query Controller] Callers of script {} in area={}", path, businessArea);
        return ResponseEntity.ok(graphRetriever.getScriptCallers(path, businessArea, limit));
    }

    private String requireArea(String area) {
        if (!sourceConfigResolver.isKnownArea(area)) {
            throw new InvalidBusinessAreaException(area, sourceConfigResolver.businessAreas());
        }
        return area.toLowerCase(Locale.ROOT);
    }
}
