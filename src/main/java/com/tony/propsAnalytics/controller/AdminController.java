package com.tony.propsAnalytics.controller;

import com.tony.propsAnalytics.job.StatRefreshJob;
import com.tony.propsAnalytics.service.PlayerStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final StatRefreshJob statRefreshJob;
    private final PlayerStatsService playerStatsService;

    /**
     * Lance le job de rafraîchissement à la main (rattrapage, environnement local).
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> forceRefresh() {
        log.info("🚀 Rafraîchissement manuel demandé par l'admin");
        try {
            int refreshed = statRefreshJob.refreshTrackedPlayers();
            return ResponseEntity.ok(Map.of("refreshed", refreshed));
        } catch (RuntimeException e) {
            log.error("❌ Erreur lors du rafraîchissement manuel", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Erreur technique lors du rafraîchissement : " + e.getMessage()));
        }
    }

    @PostMapping("/cache/purge")
    public ResponseEntity<Map<String, Integer>> purgeCache() {
        return ResponseEntity.ok(Map.of("purged", playerStatsService.purgeExpired()));
    }
}
