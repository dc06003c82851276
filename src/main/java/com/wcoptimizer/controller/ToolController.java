package com.wcoptimizer.controller;

import com.wcoptimizer.dto.AnalysisDescriptor;
import com.wcoptimizer.dto.AnalysisResult;
import com.wcoptimizer.service.AnalysisDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Name-based entry point to the analysis catalogue. Arguments arrive as a
 * free-form JSON object and are bound against the analysis's declared parameters.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final AnalysisDispatcher dispatcher;

    @GetMapping
    public ResponseEntity<List<AnalysisDescriptor>> list() {
        return ResponseEntity.ok(dispatcher.describe());
    }

    @PostMapping("/{name}")
    public ResponseEntity<AnalysisResult> run(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> arguments,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /tools/{} | args={} | requestId={}", name, arguments == null ? Map.of() : arguments, requestId);
        return ResponseEntity.ok(dispatcher.run(name, arguments));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader("X-Request-ID");
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }
}
