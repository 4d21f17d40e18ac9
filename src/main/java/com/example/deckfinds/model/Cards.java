package com.example.deckfinds.model;

import java.util.*;

/**
 * Central registry and helpers for card tokens: parsing, deck validation, the reference
 * orderings (standard and factory) and display names.
 */
public final class Cards {

    private Cards() {}

    public static final int DECK_SIZE = 52;

    // ---------------------------------------------------------------------
    // Ranks
    // ---------------------------------------------------------------------

    /** Rank symbols in ascending value order (A=1 .. K=13). */
    public static final List<String> RANKS = List.of(
            "A", "2", "3", "4", "5", "6", "7", "8", "9", "10", "J", "Q", "K"
    );

    private static final Map<String, String> RANK_PLURALS;

    static {
        LinkedHashMap<String, String> plurals = new LinkedHashMap<>();
        plurals.put("A", "Aces");
        for (int v = 2; v <= 10; v++) {
            plurals.put(String.valueOf(v), v + "s");
        }
        plurals.put("J", "Jacks");
        plurals.put("Q", "Queens");
        plurals.put("K", "Kings");
        RANK_PLURALS = Collections.unmodifiableMap(plurals);
    }

    /** "K" → "Kings", "7" → "7s", "A" → "Aces". Unknown ranks are returned unchanged. */
    public static String rankPlural(String rank) {
        return RANK_PLURALS.getOrDefault(rank, rank);
    }

    // ---------------------------------------------------------------------
    // Reference decks
    // ---------------------------------------------------------------------

    /** ♠, ♥, ♦, ♣, each A through K. Also defines the set of valid tokens. */
    public static final List<String> STANDARD_DECK;

    /**
     * A brand-new deck as it comes out of the box: spades and diamonds ascend,
     * clubs and hearts descend. Shared by the factory-run find and the factory position count.
     */
    public static final List<String> FACTORY_ORDER = List.of(
            "A♠","2♠","3♠","4♠","5♠","6♠","7♠","8♠","9♠","10♠","J♠","Q♠","K♠",
            "A♦","2♦","3♦","4♦","5♦","6♦","7♦","8♦","9♦","10♦","J♦","Q♦","K♦",
            "K♣","Q♣","J♣","10♣","9♣","8♣","7♣","6♣","5♣","4♣","3♣","2♣","A♣",
            "K♥","Q♥","J♥","10♥","9♥","8♥","7♥","6♥","5♥","4♥","3♥","2♥","A♥"
    );

    private static final Map<String, Card> CARDS_BY_TOKEN;

    static {
        List<String> deck = new ArrayList<>(DECK_SIZE);
        Map<String, Card> byToken = new HashMap<>();
        for (Suit suit : Suit.values()) {
            for (int i = 0; i < RANKS.size(); i++) {
                String token = RANKS.get(i) + suit.symbol();
                deck.add(token);
                byToken.put(token, new Card(RANKS.get(i), suit, i + 1, token));
            }
        }
        STANDARD_DECK = List.copyOf(deck);
        CARDS_BY_TOKEN = Map.copyOf(byToken);
    }

    public static boolean isValidToken(String token) {
        return token != null && CARDS_BY_TOKEN.containsKey(token);
    }

    // ---------------------------------------------------------------------
    // Parsing
    // ---------------------------------------------------------------------

    /**
     * Parse a token like "A♠" or "10♥".
     *
     * @throws InvalidDeckException if the token is not one of the 52 standard cards
     */
    public static Card parse(String token) {
        return parse(token, -1);
    }

    private static Card parse(String token, int index) {
        if (!isValidToken(token)) {
            throw InvalidDeckException.unknownToken(token, index);
        }
        return CARDS_BY_TOKEN.get(token);
    }

    /** Parse every token, preserving order and length. */
    public static List<Card> parseAll(List<String> tokens) {
        List<Card> out = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            out.add(parse(tokens.get(i), i));
        }
        return out;
    }

    /**
     * Validate that {@code tokens} is a permutation of the standard deck and parse it.
     *
     * @throws InvalidDeckException on wrong size, unknown token or duplicate card
     */
    public static Deck deckOf(List<String> tokens) {
        if (tokens == null) throw InvalidDeckException.wrongSize(0);
        if (tokens.size() != DECK_SIZE) throw InvalidDeckException.wrongSize(tokens.size());

        Map<String, Integer> seen = new HashMap<>();
        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            if (!isValidToken(t)) throw InvalidDeckException.unknownToken(t, i);
            Integer first = seen.putIfAbsent(t, i);
            if (first != null) throw InvalidDeckException.duplicate(t, first, i);
        }
        return new Deck(tokens, parseAll(tokens));
    }
}
