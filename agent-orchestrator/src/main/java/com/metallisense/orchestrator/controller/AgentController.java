package com.metallisense.orchestrator.controller;

import com.metallisense.common.model.AnalysisResult;
import com.metallisense.orchestrator.dto.AgentStatusResponse;
import com.metallisense.orchestrator.dto.AnalysisRequest;
import com.metallisense.orchestrator.service.AnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/agents")
public class AgentController {

    private final AnalysisService analysisService;

    public AgentController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public Mono<ResponseEntity<AnalysisResult>> analyze(
            @RequestBody AnalysisRequest request,
            @RequestHeader(value = "X-Request-Id", required = false) String requestId) {
        return analysisService.analyze(request.composition(), request.grade(), requestId)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/status")
    public ResponseEntity<AgentStatusResponse> status() {
        return ResponseEntity.ok(analysisService.status());
    }
}
