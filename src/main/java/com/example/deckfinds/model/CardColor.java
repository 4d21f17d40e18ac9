package com.example.deckfinds.model;

public enum CardColor {
    RED("Red", "🔴"),
    BLACK("Black", "⚫");

    private final String label;
    private final String icon;

    CardColor(String label, String icon) {
        this.label = label;
        this.icon = icon;
    }

    public String label() { return label; }
    public String icon() { return icon; }
}
