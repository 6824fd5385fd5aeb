package com.metallisense.orchestrator.controller;

import com.metallisense.orchestrator.dto.HealthResponse;
import com.metallisense.orchestrator.service.AnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final AnalysisService analysisService;

    public HealthController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(analysisService.health());
    }
}
