package com.metallisense.orchestrator.controller;

import com.metallisense.common.model.DecisionRecord;
import com.metallisense.orchestrator.service.AnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AnalysisService analysisService;

    public AuditController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @GetMapping("/recent")
    public ResponseEntity<List<DecisionRecord>> recent(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(analysisService.recentAudit(limit));
    }
}
