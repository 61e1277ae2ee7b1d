package com.hemovita.controller;

import com.hemovita.dto.mapper.ReportMapper;
import com.hemovita.dto.request.LabPanelRequest;
import com.hemovita.dto.request.LabelsRequest;
import com.hemovita.dto.response.PlanResponse;
import com.hemovita.model.enums.LabLabel;
import com.hemovita.service.ExplainerService;
import com.hemovita.service.LabClassifierService;
import com.hemovita.service.SupplementSchedulerService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the individual engine steps.
 */
@RestController
@RequestMapping("/api/analysis")
public class AnalysisController {

    private final LabClassifierService classifierService;
    private final SupplementSchedulerService schedulerService;
    private final ExplainerService explainerService;
    private final ReportMapper reportMapper;

    public AnalysisController(
            LabClassifierService classifierService,
            SupplementSchedulerService schedulerService,
            ExplainerService explainerService,
            ReportMapper reportMapper) {
        this.classifierService = classifierService;
        this.schedulerService = schedulerService;
        this.explainerService = explainerService;
        this.reportMapper = reportMapper;
    }

    @PostMapping("/classify")
    public ResponseEntity<Map<String, LabLabel>> classify(@Valid @RequestBody LabPanelRequest request) {
        return ResponseEntity.ok(classifierService.classifyPanel(reportMapper.toLabValues(request.labs())));
    }

    @PostMapping("/schedule")
    public ResponseEntity<PlanResponse> schedule(@Valid @RequestBody LabelsRequest request) {
        return ResponseEntity.ok(reportMapper.toPlanResponse(schedulerService.schedule(request.labels())));
    }

    /**
     * Causal chains for low markers; maxHops defaults to the configured depth.
     */
    @PostMapping("/explain")
    public ResponseEntity<Map<String, List<String>>> explain(@Valid @RequestBody LabelsRequest request) {
        if (request.maxHops() != null) {
            if (request.maxHops() < 1) {
                throw new IllegalArgumentException("maxHops must be at least 1");
            }
            return ResponseEntity.ok(explainerService.explain(request.labels(), request.maxHops()));
        }
        return ResponseEntity.ok(explainerService.explain(request.labels()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
