package com.example.deckfinds.model;

import java.util.List;

/**
 * A validated deck: the raw tokens and their parsed cards, index for index.
 * Instances are created through {@link Cards#deckOf(List)}.
 */
public final class Deck {

    private final List<String> tokens;
    private final List<Card> cards;

    Deck(List<String> tokens, List<Card> cards) {
        this.tokens = List.copyOf(tokens);
        this.cards = List.copyOf(cards);
    }

    public List<String> tokens() { return tokens; }
    public List<Card> cards() { return cards; }

    public Card card(int position) { return cards.get(position); }
    public String token(int position) { return tokens.get(position); }

    public int size() { return cards.size(); }

    @Override
    public String toString() {
        return String.join(",", tokens);
    }
}
