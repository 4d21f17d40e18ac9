package com.example.deckfinds.model;

/**
 * Thrown when the input is not a permutation of the standard 52-card deck.
 */
public class InvalidDeckException extends IllegalArgumentException {

    public enum Reason { WRONG_SIZE, UNKNOWN_TOKEN, DUPLICATE_CARD }

    private final Reason reason;

    public InvalidDeckException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    static InvalidDeckException wrongSize(int actual) {
        return new InvalidDeckException(Reason.WRONG_SIZE,
                "Deck must contain exactly " + Cards.DECK_SIZE + " cards but had " + actual);
    }

    static InvalidDeckException unknownToken(String token, int index) {
        String where = index >= 0 ? " at position " + index : "";
        return new InvalidDeckException(Reason.UNKNOWN_TOKEN,
                "Unrecognized card '" + token + "'" + where);
    }

    static InvalidDeckException duplicate(String token, int first, int second) {
        return new InvalidDeckException(Reason.DUPLICATE_CARD,
                "Card " + token + " appears at positions " + first + " and " + second);
    }
}
