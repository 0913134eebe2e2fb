package com.gauge.controller;

import com.gauge.config.LifecycleProperties;
import com.gauge.dto.*;
import com.gauge.model.SuffixPolicy;
import com.gauge.service.GaugeSetService;
import com.gauge.service.IdentifierAllocator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for gauge sets.
 *
 * Endpoints:
 * 1. POST /sets - Create a set from two new gauges
 * 2. POST /sets/pair - Pair two spares
 * 3. POST /sets/{setId}/replace, /unpair, /retire, /relocate - Lifecycle changes
 * 4. GET /sets/{setId}, /sets/{setId}/history, /sets/incomplete, /sets/compatibility, /sets/next-id - Reads
 *
 * Every write requires the X-Actor header.
 */
@RestController
@RequestMapping("/sets")
@RequiredArgsConstructor
@Slf4j
public class GaugeSetController {

    static final String ACTOR_HEADER = "X-Actor";

    private final GaugeSetService gaugeSetService;
    private final IdentifierAllocator identifierAllocator;
    private final LifecycleProperties properties;

    /**
     * Register two new thread gauges as a set.
     *
     * POST /sets
     */
    @PostMapping
    public ResponseEntity<GaugeSetView> createSet(@RequestHeader(ACTOR_HEADER) String actor,
                                                  @Valid @RequestBody CreateSetRequest request) {
        GaugeSetView view = gaugeSetService.createSet(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(view);
    }

    /**
     * Pair two spares.
     *
     * POST /sets/pair
     *
     * Response: 201 with the new set
     */
    @PostMapping("/pair")
    public ResponseEntity<GaugeSetView> pair(@RequestHeader(ACTOR_HEADER) String actor,
                                             @Valid @RequestBody PairSparesRequest request) {
        log.info("Pair request for gauges {} and {} from {}", request.getGoGaugeId(), request.getNoGoGaugeId(), actor);
        String setId = gaugeSetService.pairFromSpares(request, actor);
        return ResponseEntity.status(HttpStatus.CREATED).body(gaugeSetService.getSet(setId));
    }

    /**
     * Replace one member of a set with a spare.
     *
     * POST /sets/{setId}/replace
     */
    @PostMapping("/{setId}/replace")
    public ResponseEntity<GaugeSetView> replace(@PathVariable String setId,
                                                @RequestHeader(ACTOR_HEADER) String actor,
                                                @Valid @RequestBody ReplaceMemberRequest request) {
        log.info("Replace request in set {}: {} -> {}", setId, request.getExistingGaugeId(), request.getReplacementGaugeId());
        return ResponseEntity.ok(gaugeSetService.replaceMember(setId, request, actor));
    }

    @PostMapping("/{setId}/unpair")
    public ResponseEntity<Void> unpair(@PathVariable String setId,
                                       @RequestHeader(ACTOR_HEADER) String actor,
                                       @RequestBody(required = false) ReasonRequest request) {
        gaugeSetService.unpair(setId, actor, request != null ? request.getReason() : null);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{setId}/retire")
    public ResponseEntity<Void> retire(@PathVariable String setId,
                                       @RequestHeader(ACTOR_HEADER) String actor,
                                       @RequestBody(required = false) ReasonRequest request) {
        gaugeSetService.retire(setId, actor, request != null ? request.getReason() : null);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{setId}/relocate")
    public ResponseEntity<Void> relocate(@PathVariable String setId,
                                         @RequestHeader(ACTOR_HEADER) String actor,
                                         @Valid @RequestBody RelocateRequest request) {
        gaugeSetService.relocateSet(setId, request.getLocation(), actor, request.getReason());
        return ResponseEntity.noContent().build();
    }

    /**
     * Sets that lost one member and wait for a replacement.
     *
     * GET /sets/incomplete
     */
    @GetMapping("/incomplete")
    public ResponseEntity<List<GaugeSetView>> incomplete() {
        return ResponseEntity.ok(gaugeSetService.findIncompleteSets());
    }

    /**
     * Check whether two gauges could be paired, without changing anything.
     *
     * GET /sets/compatibility?go=1&noGo=2
     */
    @GetMapping("/compatibility")
    public ResponseEntity<CompatibilityResult> compatibility(@RequestParam("go") Long goGaugeId,
                                                             @RequestParam("noGo") Long noGoGaugeId) {
        return ResponseEntity.ok(gaugeSetService.checkCompatibility(goGaugeId, noGoGaugeId));
    }

    /**
     * Suggest the set id the next pairing in a category would get. Nothing is reserved.
     *
     * GET /sets/next-id?categoryId=1
     */
    @GetMapping("/next-id")
    public ResponseEntity<NextIdResponse> nextId(@RequestParam Long categoryId) {
        String next = identifierAllocator.peek(categoryId, properties.setSequenceSubType(), SuffixPolicy.NONE);
        return ResponseEntity.ok(new NextIdResponse(next));
    }

    @GetMapping("/{setId}")
    public ResponseEntity<GaugeSetView> getSet(@PathVariable String setId) {
        return ResponseEntity.ok(gaugeSetService.getSet(setId));
    }

    /**
     * Audit trail of a set, oldest first.
     *
     * GET /sets/{setId}/history
     */
    @GetMapping("/{setId}/history")
    public ResponseEntity<List<HistoryEntryResponse>> history(@PathVariable String setId) {
        return ResponseEntity.ok(gaugeSetService.history(setId));
    }

    private record NextIdResponse(String setId) {}
}
