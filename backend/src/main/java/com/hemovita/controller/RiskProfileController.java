package com.hemovita.controller;

import com.hemovita.dto.mapper.ReportMapper;
import com.hemovita.dto.request.RiskProfileRequest;
import com.hemovita.dto.response.RiskProfileResponse;
import com.hemovita.model.risk.RiskProfile;
import com.hemovita.service.RiskProfileService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST controller exposing the raw demographic risk model output.
 */
@RestController
@RequestMapping("/api/risk-profile")
public class RiskProfileController {

    private final RiskProfileService riskProfileService;
    private final ReportMapper reportMapper;

    public RiskProfileController(RiskProfileService riskProfileService, ReportMapper reportMapper) {
        this.riskProfileService = riskProfileService;
        this.reportMapper = reportMapper;
    }

    @PostMapping
    public ResponseEntity<RiskProfileResponse> riskProfile(@Valid @RequestBody RiskProfileRequest request) {
        RiskProfile profile = riskProfileService.profile(
            request.country(),
            request.population(),
            request.gender(),
            request.age());
        return ResponseEntity.ok(reportMapper.toRiskProfileResponse(profile));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", ex.getMessage()));
    }
}
