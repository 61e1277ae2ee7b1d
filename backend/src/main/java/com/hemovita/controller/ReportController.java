package com.hemovita.controller;

import com.hemovita.dto.mapper.ReportMapper;
import com.hemovita.dto.request.ReportRequest;
import com.hemovita.dto.response.ReportResponse;
import com.hemovita.model.report.Report;
import com.hemovita.service.ReportService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller for the full patient report.
 */
@RestController
@RequestMapping("/api/report")
public class ReportController {

    private final ReportService reportService;
    private final ReportMapper reportMapper;

    public ReportController(ReportService reportService, ReportMapper reportMapper) {
        this.reportService = reportService;
        this.reportMapper = reportMapper;
    }

    /**
     * Classify labs, schedule supplements, suggest foods, explain the flags
     * and attach the demographic risk profile.
     */
    @PostMapping
    public ResponseEntity<ReportResponse> generateReport(@Valid @RequestBody ReportRequest request) {
        Report report = reportService.generate(
            reportMapper.toLabValues(request.labs()),
            reportMapper.toPatientInfo(request.patient()),
            request.dietFilter());
        return ResponseEntity.ok(reportMapper.toResponse(report));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
