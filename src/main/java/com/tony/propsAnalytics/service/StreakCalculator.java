package com.tony.propsAnalytics.service;

import com.tony.propsAnalytics.model.Pick;
import com.tony.propsAnalytics.model.StreakInfo;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class StreakCalculator {

    /**
     * Série en cours : nb de matchs consécutifs (du plus récent) du même côté de la ligne.
     * Un match pile sur la ligne casse la série.
     */
    public StreakInfo calculate(List<Double> newestFirst, double line, int minStreak) {
        if (newestFirst == null || newestFirst.size() < minStreak) {
            return StreakInfo.none();
        }

        int count = 0;
        Pick type = null;
        for (Double value : newestFirst) {
            if (value == null) break;

            Pick hit;
            if (value > line) hit = Pick.OVER;
            else if (value < line) hit = Pick.UNDER;
            else break;

            if (type == null) {
                type = hit;
                count = 1;
            } else if (type == hit) {
                count++;
            } else {
                break;
            }
        }
        return new StreakInfo(count, type, count >= minStreak);
    }
}
