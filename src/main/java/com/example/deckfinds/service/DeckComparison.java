package com.example.deckfinds.service;

import com.example.deckfinds.model.Cards;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Position-by-position comparisons between decks. Unlike the factory-run find these count
 * scattered matches, not contiguous blocks.
 */
public final class DeckComparison {

    private DeckComparison() {}

    /** Matching count plus the indices that matched, in ascending order. */
    public static record Match(int count, List<Integer> positions) {
        public Match {
            positions = List.copyOf(positions);
        }
    }

    /** A candidate deck together with how well it matched. */
    public static record Closest(List<String> deck, Match match) {}

    /** Indices at which both decks hold the same card, compared over the shorter length. */
    public static Match matches(List<String> a, List<String> b) {
        if (a == null || b == null) return new Match(0, List.of());
        int n = Math.min(a.size(), b.size());
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (a.get(i) != null && a.get(i).equals(b.get(i))) positions.add(i);
        }
        return new Match(positions.size(), positions);
    }

    /** How many cards sit exactly where a brand-new deck has them. */
    public static int factoryPositions(List<String> deck) {
        return matches(deck, Cards.FACTORY_ORDER).count();
    }

    /** The candidate sharing the most positions with {@code deck}; the first one wins ties. */
    public static Optional<Closest> closestMatch(List<String> deck, Collection<List<String>> candidates) {
        if (candidates == null || candidates.isEmpty()) return Optional.empty();
        Closest best = null;
        for (List<String> candidate : candidates) {
            Match m = matches(deck, candidate);
            if (best == null || m.count() > best.match().count()) {
                best = new Closest(candidate, m);
            }
        }
        return Optional.of(best);
    }
}
