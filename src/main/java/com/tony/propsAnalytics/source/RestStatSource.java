package com.tony.propsAnalytics.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.tony.propsAnalytics.config.StatSourceProperties;
import com.tony.propsAnalytics.exception.StatSourceException;
import com.tony.propsAnalytics.model.StatCategory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.*;

/**
 * Client HTTP de la source de stats : GET {baseUrl}/players/{id}/games?last=n,
 * tableau JSON de matchs (date + stats brutes PTS, REB, AST, STL, BLK, 3PM).
 * Pas de retry ici : un échec remonte au cache qui décide du fallback.
 */
@Component
@Slf4j
public class RestStatSource implements StatSource {

    private final RestTemplate restTemplate;
    private final StatSourceProperties properties;

    // Prochain créneau libre (ms epoch) pour respecter le délai entre deux appels
    private long nextSlot = 0;

    public RestStatSource(RestTemplate statSourceRestTemplate, StatSourceProperties properties) {
        this.restTemplate = statSourceRestTemplate;
        this.properties = properties;
    }

    @Override
    public List<Double> fetch(String playerId, String statType, int lookback) {
        StatCategory category = StatCategory.fromCode(statType)
                .orElseThrow(() -> new StatSourceException(StatSourceException.Reason.NOT_FOUND, "Type de stat inconnu : " + statType));

        String url = UriComponentsBuilder.fromHttpUrl(properties.getBaseUrl())
                .pathSegment("players", playerId, "games")
                .queryParam("last", lookback)
                .toUriString();

        respectRateLimit();
        log.debug("🌐 Appel source de stats : {}", url);

        JsonNode games;
        try {
            games = restTemplate.getForObject(url, JsonNode.class);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new StatSourceException(StatSourceException.Reason.RATE_LIMITED, "Limite d'appels atteinte pour " + playerId, e);
        } catch (HttpClientErrorException.NotFound e) {
            throw new StatSourceException(StatSourceException.Reason.NOT_FOUND, "Joueur introuvable : " + playerId, e);
        } catch (RestClientException e) {
            throw new StatSourceException(StatSourceException.Reason.UNAVAILABLE, "Source de stats indisponible : " + e.getMessage(), e);
        }

        if (games == null || !games.isArray()) {
            throw new StatSourceException(StatSourceException.Reason.UNAVAILABLE, "Réponse inattendue de la source pour " + playerId);
        }
        return extractValues(games, category, lookback);
    }

    List<Double> extractValues(JsonNode games, StatCategory category, int lookback) {
        List<JsonNode> ordered = new ArrayList<>();
        games.forEach(ordered::add);
        // Le plus récent d'abord (date ISO -> tri lexical)
        ordered.sort(Comparator.comparing((JsonNode g) -> g.path("gameDate").asText("")).reversed());

        List<Double> values = new ArrayList<>();
        for (JsonNode game : ordered) {
            Map<String, Double> raw = new HashMap<>();
            game.fields().forEachRemaining(field -> {
                if (field.getValue().isNumber()) {
                    raw.put(field.getKey().toUpperCase(Locale.ROOT), field.getValue().asDouble());
                }
            });
            Double value = category.valueOf(raw);
            if (value != null) values.add(value);
            if (values.size() >= lookback) break;
        }
        return values;
    }

    private void respectRateLimit() {
        long delay = properties.getMinDelay().toMillis();
        long wait;
        synchronized (this) {
            long now = System.currentTimeMillis();
            long slot = Math.max(now, nextSlot);
            nextSlot = slot + delay;
            wait = slot - now;
        }
        if (wait <= 0) return;
        try {
            Thread.sleep(wait);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StatSourceException(StatSourceException.Reason.UNAVAILABLE, "Appel interrompu", e);
        }
    }
}
