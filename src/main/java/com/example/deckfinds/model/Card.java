package com.example.deckfinds.model;

/**
 * One parsed card. {@code value} runs A=1 .. K=13; {@code token} is the text it was parsed from.
 */
public record Card(String rank, Suit suit, int value, String token) {

    public CardColor color() {
        return suit.color();
    }

    public boolean isAce() {
        return "A".equals(rank);
    }

    /** 10, J, Q or K. */
    public boolean isTenValue() {
        return value >= 10;
    }

    public boolean sameRank(Card other) {
        return rank.equals(other.rank);
    }

    @Override
    public String toString() {
        return token;
    }
}
