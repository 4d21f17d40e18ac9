package com.example.deckfinds.model;

/**
 * Rarity tiers, declared rarest first. The declaration order is the sort order of reported finds.
 */
public enum Rarity {
    LEGENDARY("Legendary", "#fbbf24"),
    EXTRAORDINARY("Extraordinary", "#fb7185"),
    VERY_RARE("Very Rare", "#a78bfa"),
    RARE("Rare", "#60a5fa"),
    UNCOMMON("Uncommon", "#34d399"),
    COMMON("Common", "#6b7280");

    private final String label;
    /** Badge colour used by clients. */
    private final String color;

    Rarity(String label, String color) {
        this.label = label;
        this.color = color;
    }

    public String label() { return label; }
    public String color() { return color; }
}
