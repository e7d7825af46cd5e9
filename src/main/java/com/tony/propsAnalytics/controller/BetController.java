package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.exception.InvalidOddsException;
import com.tony.propsAnalytics.model.Bet;
import com.tony.propsAnalytics.model.dto.BetPerformance;
import com.tony.propsAnalytics.model.dto.BetRequest;
import com.tony.propsAnalytics.model.dto.SettleBetRequest;
import com.tony.propsAnalytics.service.BetTrackerService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/bets")
@RequiredArgsConstructor
public class BetController {

    private final BetTrackerService betTrackerService;

    @GetMapping
    public ResponseEntity<List<Bet>> getBets(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date) {
        return ResponseEntity.ok(date != null ? betTrackerService.byDate(date) : betTrackerService.findAll());
    }

    @PostMapping
    public ResponseEntity<?> placeBet(@Valid @RequestBody BetRequest request) {
        try {
            return ResponseEntity.ok(betTrackerService.placeBet(request));
        } catch (InvalidOddsException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/pending")
    public ResponseEntity<List<Bet>> pending() {
        return ResponseEntity.ok(betTrackerService.pending());
    }

    @GetMapping("/today")
    public ResponseEntity<List<Bet>> today() {
        return ResponseEntity.ok(betTrackerService.today());
    }

    @GetMapping("/yesterday")
    public ResponseEntity<List<Bet>> yesterday() {
        return ResponseEntity.ok(betTrackerService.yesterday());
    }

    @PutMapping("/{id}/closing-odds")
    public ResponseEntity<?> updateClosingOdds(@PathVariable Long id, @RequestParam int odds) {
        try {
            return betTrackerService.updateClosingOdds(id, odds)
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (InvalidOddsException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/{id}/settle")
    public ResponseEntity<?> settle(@PathVariable Long id, @Valid @RequestBody SettleBetRequest request) {
        try {
            return betTrackerService.settle(id, request.getActualStat(), request.getClosingOdds())
                    .<ResponseEntity<?>>map(ResponseEntity::ok)
                    .orElse(ResponseEntity.notFound().build());
        } catch (InvalidOddsException | IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        return betTrackerService.delete(id)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    // Bilan sur les N derniers jours (7 par défaut)
    @GetMapping("/performance")
    public ResponseEntity<?> performance(@RequestParam(defaultValue = "7") int days) {
        try {
            BetPerformance performance = betTrackerService.calculatePerformance(betTrackerService.recent(days));
            return ResponseEntity.ok(performance);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }
}
