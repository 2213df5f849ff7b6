package com.civica.controller;

import com.civica.model.dto.GatewayStatistics;
import com.civica.model.dto.ServiceStatus;
import com.civica.service.SimulationAiGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Monitoring endpoints for the analysis gateway.
 */
@Slf4j
@RestController
@RequestMapping("/v1/gateway")
public class GatewayController {

    private final SimulationAiGateway gateway;

    public GatewayController(SimulationAiGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping("/stats")
    public ResponseEntity<GatewayStatistics> getStats() {
        return ResponseEntity.ok(gateway.getStatistics());
    }

    @GetMapping("/status")
    public ResponseEntity<ServiceStatus> getStatus() {
        return ResponseEntity.ok(gateway.getServiceStatus());
    }

    /**
     * Clear both response tiers and the offline cache.
     */
    @PostMapping("/cache/clear")
    public ResponseEntity<Map<String, String>> clearCache() {
        log.info("Cache clear requested");
        gateway.clearCaches();

        return ResponseEntity.ok(Map.of(
                "status", "success",
                "message", "Cache cleared (exact + bucket + offline)"
        ));
    }
}
