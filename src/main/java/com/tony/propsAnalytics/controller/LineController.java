package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.model.AltLineEntry;
import com.tony.propsAnalytics.model.ChaseListEntry;
import com.tony.propsAnalytics.model.LineChangeEvent;
import com.tony.propsAnalytics.model.dto.AltLineRequest;
import com.tony.propsAnalytics.model.dto.ChaseListRequest;
import com.tony.propsAnalytics.model.dto.LineRequest;
import com.tony.propsAnalytics.service.LineHistoryTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/lines")
@RequiredArgsConstructor
public class LineController {

    private final LineHistoryTracker tracker;

    @PostMapping
    public ResponseEntity<?> recordLine(@Valid @RequestBody LineRequest request) {
        return tracker.recordLine(request.getPlayerId(), request.getStatType(), request.getValue(), request.getTimestamp())
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of("changed", false)));
    }

    // Correction manuelle d'une ligne déjà envoyée (auditée dans l'historique)
    @PutMapping("/{playerId}/{statType}")
    public ResponseEntity<?> editLine(@PathVariable String playerId,
                                      @PathVariable String statType,
                                      @RequestParam double value) {
        return tracker.editLine(playerId, statType, value)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.ok(Map.of("changed", false)));
    }

    @GetMapping("/{playerId}/{statType}")
    public ResponseEntity<?> currentLine(@PathVariable String playerId, @PathVariable String statType) {
        return tracker.currentLine(playerId, statType)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/changes")
    public ResponseEntity<List<LineChangeEvent>> getChanges(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since,
            @RequestParam(required = false) String playerId,
            @RequestParam(required = false) String statType) {
        Instant from = since != null ? since : Instant.EPOCH;
        if (playerId != null && statType != null) {
            return ResponseEntity.ok(tracker.getChanges(playerId, statType, from));
        }
        return ResponseEntity.ok(tracker.getChanges(from));
    }

    // --- Chase list ---

    @GetMapping("/chase")
    public ResponseEntity<List<ChaseListEntry>> listChase() {
        return ResponseEntity.ok(tracker.listChase());
    }

    @PostMapping("/chase")
    public ResponseEntity<ChaseListEntry> addToChase(@Valid @RequestBody ChaseListRequest request) {
        return ResponseEntity.ok(tracker.addToChaseList(
                request.getPlayerId(), request.getStatType(), request.getLineValue(), request.getReason()));
    }

    @DeleteMapping("/chase/{playerId}/{statType}")
    public ResponseEntity<Void> removeFromChase(@PathVariable String playerId, @PathVariable String statType) {
        return tracker.removeFromChaseList(playerId, statType)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // --- Lignes alternatives ---

    @PostMapping("/alt")
    public ResponseEntity<AltLineEntry> addAltLine(@Valid @RequestBody AltLineRequest request) {
        return ResponseEntity.ok(tracker.addAltLine(request.getPlayerId(), request.getStatType(),
                request.getMainLine(), request.getAltLine(), request.getSource()));
    }

    @GetMapping("/alt/{playerId}/{statType}")
    public ResponseEntity<List<AltLineEntry>> listAltLines(@PathVariable String playerId, @PathVariable String statType) {
        return ResponseEntity.ok(tracker.listAltLines(playerId, statType));
    }
}
