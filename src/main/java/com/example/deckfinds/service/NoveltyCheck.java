package com.example.deckfinds.service;

import com.example.deckfinds.model.Find;

/**
 * Port for deciding whether a find is new to whoever is looking at the deck.
 * The engine itself knows nothing about viewers; a history store can implement this.
 */
public interface NoveltyCheck {

    boolean isNew(Find find);
}
