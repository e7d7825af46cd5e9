package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.AltLineEntry;
import com.tony.propsAnalytics.model.Line;
import com.tony.propsAnalytics.model.LineChangeEvent;
import com.tony.propsAnalytics.model.LineKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Historique des lignes : ligne courante par prop, journal des mouvements (ajout seul)
 * et registre des lignes alternatives (ajout seul).
 */
public interface HistoryStore {

    Optional<Line> findCurrent(LineKey key);

    /**
     * Remplace la ligne courante et ajoute l'événement de mouvement s'il y en a un, en une seule unité :
     * si l'un échoue, rien n'est écrit (un nouvel essai ne doit pas dupliquer l'événement).
     *
     * @param event mouvement à journaliser, null pour une première ligne
     * @return l'événement enregistré, vide si aucun
     */
    Optional<LineChangeEvent> recordChange(Line line, LineChangeEvent event);

    /** Événements observés à partir de {@code since}, du plus ancien au plus récent. */
    List<LineChangeEvent> findChangesSince(Instant since);

    List<LineChangeEvent> findChangesSince(LineKey key, Instant since);

    AltLineEntry appendAltLine(AltLineEntry entry);

    List<AltLineEntry> findAltLines(LineKey key);
}
