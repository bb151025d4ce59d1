package com.baykanat.health.store.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/** Servis bilgisi ve liveness. */
@RestController
@Tag(name = "Status", description = "Service banner and liveness")
public class StatusController {

    @GetMapping("/")
    @Operation(summary = "Service banner")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Health Store API");
        body.put("java_version", Runtime.version().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    @Operation(summary = "Liveness check")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("java_version", Runtime.version().toString());
        return ResponseEntity.ok(body);
    }
}
