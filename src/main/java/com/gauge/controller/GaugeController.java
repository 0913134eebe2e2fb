package com.gauge.controller;

import com.gauge.dto.*;
import com.gauge.service.GaugeRegistrationService;
import com.gauge.service.GaugeSetService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for individual gauges.
 *
 * Endpoints:
 * 1. POST /gauges/spares - Register a spare thread gauge
 * 2. POST /gauges - Register a gauge that is never paired
 * 3. GET /gauges/spares?categoryId= - List spares of a category
 * 4. POST /gauges/{id}/status - Out of service / return to service, cascades to the companion
 * 5. GET /gauges/{id}/history - Ledger entries naming the gauge
 */
@RestController
@RequestMapping("/gauges")
@RequiredArgsConstructor
@Slf4j
public class GaugeController {

    private final GaugeRegistrationService registrationService;
    private final GaugeSetService gaugeSetService;

    @PostMapping("/spares")
    public ResponseEntity<GaugeResponse> registerSpare(@Valid @RequestBody GaugeRegistrationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.registerSpare(request));
    }

    @PostMapping
    public ResponseEntity<GaugeResponse> registerGauge(@Valid @RequestBody GaugeRegistrationRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registrationService.registerGauge(request));
    }

    @GetMapping("/spares")
    public ResponseEntity<List<GaugeResponse>> spares(@RequestParam Long categoryId) {
        return ResponseEntity.ok(gaugeSetService.findSpares(categoryId));
    }

    /**
     * Change the status of a gauge and its companion.
     *
     * POST /gauges/{id}/status
     *
     * Request body: {"status": "out_of_service", "reason": "..."}
     */
    @PostMapping("/{id}/status")
    public ResponseEntity<CascadeResult> changeStatus(@PathVariable Long id,
                                                      @RequestHeader(GaugeSetController.ACTOR_HEADER) String actor,
                                                      @Valid @RequestBody StatusChangeRequest request) {
        log.info("Status change for gauge {} to {} from {}", id, request.getStatus(), actor);
        return ResponseEntity.ok(gaugeSetService.cascadeStatus(id, request.getStatus(), actor, request.getReason()));
    }

    @GetMapping("/{id}/history")
    public ResponseEntity<List<HistoryEntryResponse>> history(@PathVariable Long id) {
        return ResponseEntity.ok(gaugeSetService.historyForGauge(id));
    }
}
