package com.wcoptimizer.controller;

import com.wcoptimizer.dto.DatabaseStatusResponse;
import com.wcoptimizer.dto.DatasetStatusResponse;
import com.wcoptimizer.dto.DatasetTemplateResponse;
import com.wcoptimizer.dto.ResetResponse;
import com.wcoptimizer.dto.SqlQueryRequest;
import com.wcoptimizer.dto.SqlQueryResponse;
import com.wcoptimizer.dto.UploadResponse;
import com.wcoptimizer.service.DatasetIngestService;
import com.wcoptimizer.service.DatasetService;
import com.wcoptimizer.service.QueryGateService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;
import java.util.UUID;

@Slf4j
@Validated
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class DatasetController {

    private final DatasetIngestService ingestService;
    private final DatasetService datasetService;
    private final QueryGateService queryGate;

    @PostMapping(value = "/files/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<UploadResponse> upload(
            @RequestParam String category,
            @RequestPart("file") MultipartFile file,
            HttpServletRequest httpRequest) {
        String requestId = resolveRequestId(httpRequest);
        log.info("POST /files/upload | category={} | file={} | size={} | requestId={}",
            category, file.getOriginalFilename(), file.getSize(), requestId);
        return ResponseEntity.ok(ingestService.upload(category, file));
    }

    @GetMapping("/files/status")
    public ResponseEntity<DatasetStatusResponse> status() {
        return ResponseEntity.ok(datasetService.datasetStatus());
    }

    @GetMapping("/templates")
    public ResponseEntity<List<DatasetTemplateResponse>> templates() {
        return ResponseEntity.ok(datasetService.templates());
    }

    @GetMapping("/templates/{category}")
    public ResponseEntity<DatasetTemplateResponse> template(@PathVariable String category) {
        return ResponseEntity.ok(datasetService.template(category));
    }

    @GetMapping("/database/status")
    public ResponseEntity<DatabaseStatusResponse> databaseStatus() {
        return ResponseEntity.ok(datasetService.databaseStatus());
    }

    @PostMapping("/database/reset")
    public ResponseEntity<ResetResponse> reset(HttpServletRequest httpRequest) {
        log.warn("POST /database/reset | requestId={}", resolveRequestId(httpRequest));
        return ResponseEntity.ok(datasetService.reset());
    }

    @PostMapping("/database/query")
    public ResponseEntity<SqlQueryResponse> query(
            @Valid @RequestBody SqlQueryRequest request, HttpServletRequest httpRequest) {
        log.info("POST /database/query | requestId={}", resolveRequestId(httpRequest));
        return ResponseEntity.ok(queryGate.run(request.getSql()));
    }

    private String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader("X-Request-ID");
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }
}
