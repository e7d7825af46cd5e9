package com.tony.propsAnalytics.repository;

import com.tony.propsAnalytics.model.ChaseListEntry;
import com.tony.propsAnalytics.model.LineKey;

import java.util.List;

/**
 * Chase list : unicité sur (joueur, stat).
 */
public interface WatchlistStore {

    /** Ajoute ou remplace l'entrée de la même prop. */
    ChaseListEntry upsert(ChaseListEntry entry);

    boolean remove(LineKey key);

    List<ChaseListEntry> findAll();
}
