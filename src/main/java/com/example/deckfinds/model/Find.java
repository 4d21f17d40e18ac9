package com.example.deckfinds.model;

import java.util.List;
import java.util.Objects;

/**
 * A single detected pattern instance: which catalogue entry it is, how it is shown and which deck
 * positions it occupies.
 */
public record Find(String id, String name, String icon, Rarity rarity, List<Integer> positions) {

    public Find {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(rarity, "rarity");
        if (positions == null || positions.isEmpty()) {
            throw new IllegalArgumentException("positions must not be null/empty");
        }
        positions = List.copyOf(positions);
    }

    public String color() {
        return rarity.color();
    }

    /** True if both finds share at least one deck position. */
    public boolean overlaps(Find other) {
        for (Integer p : other.positions) {
            if (positions.contains(p)) return true;
        }
        return false;
    }
}
