package com.tony.propsAnalytics.job;

import com.tony.propsAnalytics.config.EdgeProperties;
import com.tony.propsAnalytics.model.ChaseListEntry;
import com.tony.propsAnalytics.service.LineHistoryTracker;
import com.tony.propsAnalytics.service.PlayerStatsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Déclencheur externe du rafraîchissement : le cœur n'a pas de timer, ce job l'appelle.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StatRefreshJob {

    private final PlayerStatsService playerStatsService;
    private final LineHistoryTracker lineHistoryTracker;
    private final EdgeProperties edgeProperties;

    /**
     * Rafraîchit les stats de toutes les props de la chase list puis purge le cache.
     * Fréquence : tous les jours à 09:00 par défaut (stats.refresh.cron).
     *
     * @return nombre de props rafraîchies avec succès
     */
    @Scheduled(cron = "${stats.refresh.cron:0 0 9 * * *}")
    public int refreshTrackedPlayers() {
        List<ChaseListEntry> tracked = lineHistoryTracker.listChase();
        log.info("⏰ [CRON] Rafraîchissement des stats pour {} prop(s) suivie(s)...", tracked.size());

        int lookback = Math.max(edgeProperties.getWindow(), edgeProperties.getStreakLookback());
        int refreshed = 0;
        for (ChaseListEntry entry : tracked) {
            try {
                playerStatsService.getRecentValues(entry.getPlayerId(), entry.getStatType(), lookback, true);
                refreshed++;
            } catch (RuntimeException e) {
                log.error("❌ [CRON] Echec du rafraîchissement de {} {}", entry.getPlayerId(), entry.getStatType(), e);
            }
        }

        int purged = playerStatsService.purgeExpired();
        log.info("✅ [CRON] {} prop(s) rafraîchie(s), {} entrée(s) de cache purgée(s).", refreshed, purged);
        return refreshed;
    }
}
