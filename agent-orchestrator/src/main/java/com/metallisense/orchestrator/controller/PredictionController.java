package com.metallisense.orchestrator.controller;

import com.metallisense.common.model.AnomalyResult;
import com.metallisense.common.model.CorrectionResult;
import com.metallisense.orchestrator.dto.AnalysisRequest;
import com.metallisense.orchestrator.dto.AnomalyRequest;
import com.metallisense.orchestrator.service.AnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

/** Single-stage endpoints. They bypass the policy gate and write no audit records. */
@RestController
@RequestMapping("/api/v1")
public class PredictionController {

    private final AnalysisService analysisService;

    public PredictionController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/anomaly/predict")
    public Mono<ResponseEntity<AnomalyResult>> predictAnomaly(@RequestBody AnomalyRequest request) {
        return analysisService.predictAnomaly(request.composition(), request.grade()).map(ResponseEntity::ok);
    }

    @PostMapping("/alloy/recommend")
    public Mono<ResponseEntity<CorrectionResult>> recommendAlloy(@RequestBody AnalysisRequest request) {
        return analysisService.recommendAlloy(request.composition(), request.grade()).map(ResponseEntity::ok);
    }
}
