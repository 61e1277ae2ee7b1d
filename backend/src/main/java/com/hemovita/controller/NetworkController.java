package com.hemovita.controller;

import com.hemovita.dto.response.NetworkGraphDto;
import com.hemovita.service.NetworkGraphService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the nutrient network visualisation.
 */
@RestController
@RequestMapping("/api/network")
public class NetworkController {

    private final NetworkGraphService networkGraphService;

    public NetworkController(NetworkGraphService networkGraphService) {
        this.networkGraphService = networkGraphService;
    }

    @GetMapping("/graph")
    public ResponseEntity<NetworkGraphDto> getGraph() {
        return ResponseEntity.ok(networkGraphService.buildGraph());
    }
}
