package com.metallisense.orchestrator.controller;

import com.metallisense.common.exception.UnknownGradeException;
import com.metallisense.common.grade.GradeDocument;
import com.metallisense.orchestrator.dto.ErrorResponse;
import com.metallisense.orchestrator.dto.GradeListResponse;
import com.metallisense.orchestrator.service.AnalysisService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/grades")
public class GradeController {

    private final AnalysisService analysisService;

    public GradeController(AnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @GetMapping
    public ResponseEntity<GradeListResponse> grades() {
        return ResponseEntity.ok(analysisService.grades());
    }

    @GetMapping("/{grade}")
    public ResponseEntity<GradeDocument> grade(@PathVariable String grade) {
        return ResponseEntity.ok(analysisService.gradeSpec(grade));
    }

    // A missing grade is a missing resource here, unlike on the recommend endpoint.
    @ExceptionHandler(UnknownGradeException.class)
    public ResponseEntity<ErrorResponse> unknownGrade(UnknownGradeException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(new ErrorResponse(e.getMessage(), HttpStatus.NOT_FOUND.value()));
    }
}
