package com.example.deckfinds.finds;

import java.util.List;

/** Stable identifiers of every catalogue entry. */
public final class FindIds {

    private FindIds() {}

    public static final String PAIR = "pair";
    public static final String TRIPLE = "triple";
    public static final String QUAD = "quad";

    public static final String SUITED_3 = "suited-3";
    public static final String SUITED_4 = "suited-4";
    public static final String SUITED_5 = "suited-5";
    public static final String SUITED_6 = "suited-6";
    public static final String SUITED_7 = "suited-7";
    public static final String SUITED_8 = "suited-8";

    public static final String RUN_3 = "run-3";
    public static final String RUN_4 = "run-4";
    public static final String STRAIGHT = "straight";
    public static final String RUN_6 = "run-6";
    public static final String RUN_7 = "run-7";

    public static final String COLOUR_6 = "colour-6";
    public static final String COLOUR_8 = "colour-8";
    public static final String COLOUR_10 = "colour-10";

    public static final String ALTERNATING_7 = "alternating-7";
    public static final String ALTERNATING_10 = "alternating-10";

    public static final String BLACKJACK = "blackjack";
    public static final String SUITED_BLACKJACK = "suited-blackjack";
    public static final String PERFECT_BLACKJACK = "perfect-blackjack";

    public static final String THREE_PAIRS = "three-pairs";
    public static final String TWO_TRIPLES = "two-triples";
    public static final String TWO_QUADS = "two-quads";

    public static final String MIRROR = "mirror";
    public static final String TWO_PAIR = "two-pair";
    public static final String FULL_HOUSE = "full-house";
    public static final String STRAIGHT_FLUSH = "straight-flush";
    public static final String ROYAL_FLUSH = "royal-flush";
    public static final String DEAD_MANS_HAND = "dead-mans-hand";
    public static final String SOLITAIRE = "solitaire-5";
    public static final String ACE_HIGH = "ace-high";
    public static final String ASCENDING_TOP_5 = "ascending-top-5";
    public static final String FACTORY_RUN = "factory-run";

    public static final List<String> SUITED = List.of(
            SUITED_3, SUITED_4, SUITED_5, SUITED_6, SUITED_7, SUITED_8
    );
}
