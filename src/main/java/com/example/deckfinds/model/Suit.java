package com.example.deckfinds.model;

/** The four French suits, keyed by the symbol that ends every card token. */
public enum Suit {
    SPADES("♠", "Spades", CardColor.BLACK),
    HEARTS("♥", "Hearts", CardColor.RED),
    DIAMONDS("♦", "Diamonds", CardColor.RED),
    CLUBS("♣", "Clubs", CardColor.BLACK);

    private final String symbol;
    private final String displayName;
    private final CardColor color;

    Suit(String symbol, String displayName, CardColor color) {
        this.symbol = symbol;
        this.displayName = displayName;
        this.color = color;
    }

    public String symbol() { return symbol; }
    public String displayName() { return displayName; }
    public CardColor color() { return color; }
}
