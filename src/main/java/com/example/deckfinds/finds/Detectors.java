package com.example.deckfinds.finds;

import com.example.deckfinds.model.Card;
import com.example.deckfinds.model.Cards;
import com.example.deckfinds.model.Deck;
import com.example.deckfinds.model.Find;
import com.example.deckfinds.model.Rarity;

import java.util.ArrayList;
import java.util.List;

import static com.example.deckfinds.finds.FindIds.*;

/**
 * The detector catalogue. One stateless scan per pattern family, each returning its candidate finds
 * in deck order.
 * <p>
 * Run-shaped scans report maximal runs only: the longest stretch that cannot be extended, labelled
 * with the single best tier it qualifies for. A five-long suited streak never also yields the
 * three-long streak inside it.
 */
public final class Detectors {

    private Detectors() {}

    private static final String CARD_ICON = "🃏";
    private static final String BLACKJACK_ICON = "🂡";

    /** Start/end of a candidate run; {@code i} is the index being tested for continuation. */
    @FunctionalInterface
    private interface Continues {
        boolean test(int start, int i);
    }

    // ---------------------------------------------------------------------
    // Same-rank groups: Pair, Triple, Quad
    // ---------------------------------------------------------------------

    public static List<Find> sameRankGroups(Deck deck) {
        List<Find> finds = new ArrayList<>();
        List<Card> cards = deck.cards();
        int i = 0;
        while (i < cards.size()) {
            int j = i + 1;
            while (j < cards.size() && cards.get(j).sameRank(cards.get(i))) j++;

            int size = j - i;
            String plural = Cards.rankPlural(cards.get(i).rank());
            if (size >= 4) {
                finds.add(new Find(QUAD, "Quad " + plural, CARD_ICON, Rarity.VERY_RARE, range(i, j)));
            } else if (size == 3) {
                finds.add(new Find(TRIPLE, "Triple " + plural, CARD_ICON, Rarity.UNCOMMON, range(i, j)));
            } else if (size == 2) {
                finds.add(new Find(PAIR, "Pair of " + plural, CARD_ICON, Rarity.COMMON, range(i, j)));
            }
            i = j;
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Suited streaks: 3 .. 8+
    // ---------------------------------------------------------------------

    public static List<Find> suitedStreaks(Deck deck) {
        List<Card> cards = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int[] run : maximalRuns(cards.size(), (start, i) -> cards.get(i).suit() == cards.get(start).suit())) {
            int len = run[1] - run[0];
            if (len < 3) continue;
            Card first = cards.get(run[0]);
            String suitName = first.suit().displayName();

            String id;
            String name;
            Rarity rarity;
            if (len >= 8) {
                id = SUITED_8; name = "8+ " + suitName; rarity = Rarity.EXTRAORDINARY;
            } else if (len == 7) {
                id = SUITED_7; name = "7 " + suitName; rarity = Rarity.VERY_RARE;
            } else if (len == 6) {
                id = SUITED_6; name = "6 " + suitName; rarity = Rarity.RARE;
            } else if (len == 5) {
                id = SUITED_5; name = "5 " + suitName; rarity = Rarity.RARE;
            } else if (len == 4) {
                id = SUITED_4; name = "4 " + suitName; rarity = Rarity.UNCOMMON;
            } else {
                id = SUITED_3; name = "3 " + suitName; rarity = Rarity.COMMON;
            }
            finds.add(new Find(id, name, first.suit().symbol(), rarity, range(run[0], run[1])));
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Rank runs: Run of 3/4, Straight, Run of 6/7+
    // ---------------------------------------------------------------------

    /**
     * Ascending runs of consecutive value. When a run stops on a King and the next card is an Ace,
     * the Ace counts as 14 and closes the run; the next run starts after it.
     */
    public static List<Find> rankRuns(Deck deck) {
        List<Find> finds = new ArrayList<>();
        List<Card> cards = deck.cards();
        int n = cards.size();
        int start = 0;
        int i = 1;
        while (i <= n) {
            boolean continues = i < n && cards.get(i).value() == cards.get(i - 1).value() + 1;
            if (!continues) {
                int end = i;
                if (end < n && cards.get(end - 1).value() == 13 && cards.get(end).isAce()) {
                    end++;
                }
                int len = end - start;
                if (len >= 3) {
                    finds.add(runFind(len, range(start, end)));
                }
                start = end;
                i = end;
            }
            i++;
        }
        return finds;
    }

    private static Find runFind(int len, List<Integer> positions) {
        String icon = "📈";
        if (len >= 7) return new Find(RUN_7, "Run of " + len, icon, Rarity.VERY_RARE, positions);
        if (len == 6) return new Find(RUN_6, "Run of 6", icon, Rarity.VERY_RARE, positions);
        if (len == 5) return new Find(STRAIGHT, "Straight", icon, Rarity.RARE, positions);
        if (len == 4) return new Find(RUN_4, "Run of 4", icon, Rarity.UNCOMMON, positions);
        return new Find(RUN_3, "Run of 3", icon, Rarity.COMMON, positions);
    }

    // ---------------------------------------------------------------------
    // Colour streaks and alternating colour
    // ---------------------------------------------------------------------

    public static List<Find> colourStreaks(Deck deck) {
        List<Card> cards = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int[] run : maximalRuns(cards.size(), (start, i) -> cards.get(i).color() == cards.get(start).color())) {
            int len = run[1] - run[0];
            if (len < 6) continue;
            Card first = cards.get(run[0]);
            String name = first.color().label() + " Streak of " + len;

            String id;
            Rarity rarity;
            if (len >= 10) {
                id = COLOUR_10; rarity = Rarity.VERY_RARE;
            } else if (len >= 8) {
                id = COLOUR_8; rarity = Rarity.RARE;
            } else {
                id = COLOUR_6; rarity = Rarity.UNCOMMON;
            }
            finds.add(new Find(id, name, first.color().icon(), rarity, range(run[0], run[1])));
        }
        return finds;
    }

    public static List<Find> alternatingColours(Deck deck) {
        List<Card> cards = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int[] run : maximalRuns(cards.size(), (start, i) -> cards.get(i).color() != cards.get(i - 1).color())) {
            int len = run[1] - run[0];
            if (len < 7) continue;
            boolean long10 = len >= 10;
            finds.add(new Find(long10 ? ALTERNATING_10 : ALTERNATING_7, "Alternating " + len, "🎭",
                    long10 ? Rarity.VERY_RARE : Rarity.RARE, range(run[0], run[1])));
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Blackjack family
    // ---------------------------------------------------------------------

    /**
     * Every adjacent Ace + ten-value pair, in either order. Overlapping pairs are all reported;
     * the reconciler keeps the best one.
     */
    public static List<Find> blackjacks(Deck deck) {
        List<Find> finds = new ArrayList<>();
        List<Card> cards = deck.cards();
        for (int i = 0; i < cards.size() - 1; i++) {
            Card a = cards.get(i);
            Card b = cards.get(i + 1);

            Card ace;
            Card ten;
            if (a.isAce() && b.isTenValue()) {
                ace = a; ten = b;
            } else if (b.isAce() && a.isTenValue()) {
                ace = b; ten = a;
            } else {
                continue;
            }

            List<Integer> positions = List.of(i, i + 1);
            if ("A♠".equals(ace.token()) && "J♠".equals(ten.token())) {
                finds.add(new Find(PERFECT_BLACKJACK, "Perfect Blackjack", BLACKJACK_ICON, Rarity.RARE, positions));
            } else if (ace.suit() == ten.suit()) {
                finds.add(new Find(SUITED_BLACKJACK, "Suited Blackjack", BLACKJACK_ICON, Rarity.UNCOMMON, positions));
            } else {
                finds.add(new Find(BLACKJACK, "Blackjack", BLACKJACK_ICON, Rarity.COMMON, positions));
            }
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Counting finds (derived from the same-rank groups)
    // ---------------------------------------------------------------------

    /**
     * Counts pairs, triples and quads across the whole deck. Takes the output of
     * {@link #sameRankGroups(Deck)} rather than rescanning.
     */
    public static List<Find> countingFinds(List<Find> sameRankGroups) {
        List<Find> pairs = withId(sameRankGroups, PAIR);
        List<Find> triples = withId(sameRankGroups, TRIPLE);
        List<Find> quads = withId(sameRankGroups, QUAD);

        List<Find> finds = new ArrayList<>();
        if (pairs.size() >= 3) {
            finds.add(new Find(THREE_PAIRS, pairs.size() + " Pairs", CARD_ICON, Rarity.UNCOMMON, allPositions(pairs)));
        }
        if (triples.size() >= 2) {
            finds.add(new Find(TWO_TRIPLES, "Two Triples", CARD_ICON, Rarity.RARE, allPositions(triples)));
        }
        if (quads.size() >= 2) {
            finds.add(new Find(TWO_QUADS, "Two Quads", CARD_ICON, Rarity.EXTRAORDINARY, allPositions(quads)));
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Mirror
    // ---------------------------------------------------------------------

    /** Same rank at i and 51-i; three or more such pairs make one find. */
    public static List<Find> mirror(Deck deck) {
        List<Card> cards = deck.cards();
        int last = cards.size() - 1;
        List<Integer> positions = new ArrayList<>();
        for (int i = 0; i < cards.size() / 2; i++) {
            if (cards.get(i).sameRank(cards.get(last - i))) {
                positions.add(i);
                positions.add(last - i);
            }
        }
        int mirrors = positions.size() / 2;
        if (mirrors < 3) return List.of();
        return List.of(new Find(MIRROR, mirrors + " Mirrors", "🪞", Rarity.UNCOMMON, positions));
    }

    // ---------------------------------------------------------------------
    // Fixed windows: Two Pair, Full House, Dead Man's Hand
    // ---------------------------------------------------------------------

    /** AABB in four consecutive cards. */
    public static List<Find> twoPair(Deck deck) {
        List<Card> c = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int i = 0; i + 4 <= c.size(); i++) {
            if (c.get(i).sameRank(c.get(i + 1))
                    && c.get(i + 2).sameRank(c.get(i + 3))
                    && !c.get(i).sameRank(c.get(i + 2))) {
                finds.add(new Find(TWO_PAIR, "Two Pair", CARD_ICON, Rarity.RARE, range(i, i + 4)));
            }
        }
        return finds;
    }

    /** AAABB or AABBB in five consecutive cards. */
    public static List<Find> fullHouse(Deck deck) {
        List<Card> c = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int i = 0; i + 5 <= c.size(); i++) {
            Card c0 = c.get(i), c1 = c.get(i + 1), c2 = c.get(i + 2), c3 = c.get(i + 3), c4 = c.get(i + 4);
            boolean threeTwo = c0.sameRank(c1) && c1.sameRank(c2) && c3.sameRank(c4) && !c0.sameRank(c3);
            boolean twoThree = c0.sameRank(c1) && c2.sameRank(c3) && c3.sameRank(c4) && !c0.sameRank(c2);
            if (threeTwo || twoThree) {
                finds.add(new Find(FULL_HOUSE, "Full House", "🏠", Rarity.VERY_RARE, range(i, i + 5)));
            }
        }
        return finds;
    }

    /** Exactly two Aces and two Eights, any order, in four consecutive cards. */
    public static List<Find> deadMansHand(Deck deck) {
        List<Card> c = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int i = 0; i + 4 <= c.size(); i++) {
            int aces = 0;
            int eights = 0;
            for (int k = i; k < i + 4; k++) {
                if (c.get(k).isAce()) aces++;
                else if ("8".equals(c.get(k).rank())) eights++;
            }
            if (aces == 2 && eights == 2) {
                finds.add(new Find(DEAD_MANS_HAND, "Dead Man's Hand", "💀", Rarity.EXTRAORDINARY, range(i, i + 4)));
            }
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Straight Flush / Royal Flush
    // ---------------------------------------------------------------------

    /**
     * Runs that are both same-suit and ascending. A same-suit Ace directly after a King continues the
     * run. Five or more cards qualify; holding 10, J, Q, K and A makes it royal.
     */
    public static List<Find> straightFlushes(Deck deck) {
        List<Card> cards = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int[] run : maximalRuns(cards.size(), (start, i) -> {
            Card prev = cards.get(i - 1);
            Card cur = cards.get(i);
            boolean ascending = cur.value() == prev.value() + 1;
            boolean aceHigh = prev.value() == 13 && cur.isAce();
            return cur.suit() == cards.get(start).suit() && (ascending || aceHigh);
        })) {
            if (run[1] - run[0] < 5) continue;
            List<Integer> positions = range(run[0], run[1]);
            List<Integer> values = new ArrayList<>();
            for (int p : positions) values.add(cards.get(p).value());

            boolean royal = values.containsAll(List.of(1, 10, 11, 12, 13));
            if (royal) {
                String suitName = cards.get(run[0]).suit().displayName();
                finds.add(new Find(ROYAL_FLUSH, "Royal Flush (" + suitName + ")", "👑", Rarity.LEGENDARY, positions));
            } else {
                finds.add(new Find(STRAIGHT_FLUSH, "Straight Flush", "⚡", Rarity.EXTRAORDINARY, positions));
            }
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Solitaire run
    // ---------------------------------------------------------------------

    /** Descending by one and alternating colour, like a Klondike column. */
    public static List<Find> solitaireRuns(Deck deck) {
        List<Card> cards = deck.cards();
        List<Find> finds = new ArrayList<>();
        for (int[] run : maximalRuns(cards.size(), (start, i) ->
                cards.get(i).value() == cards.get(i - 1).value() - 1
                        && cards.get(i).color() != cards.get(i - 1).color())) {
            int len = run[1] - run[0];
            if (len >= 5) {
                finds.add(new Find(SOLITAIRE, "Solitaire " + len, "🂠", Rarity.EXTRAORDINARY, range(run[0], run[1])));
            }
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Top of the deck
    // ---------------------------------------------------------------------

    public static List<Find> aceHigh(Deck deck) {
        if (deck.size() > 0 && "A♠".equals(deck.token(0))) {
            return List.of(new Find(ACE_HIGH, "Ace High", BLACKJACK_ICON, Rarity.RARE, List.of(0)));
        }
        return List.of();
    }

    public static List<Find> ascendingTopFive(Deck deck) {
        if (deck.size() < 5) return List.of();
        for (int i = 1; i < 5; i++) {
            if (deck.card(i).value() <= deck.card(i - 1).value()) return List.of();
        }
        return List.of(new Find(ASCENDING_TOP_5, "Ascending Top Five", "⬆️", Rarity.EXTRAORDINARY, range(0, 5)));
    }

    // ---------------------------------------------------------------------
    // Factory run (raw tokens)
    // ---------------------------------------------------------------------

    /** Blocks of four or more cards still sitting exactly where the factory put them. */
    public static List<Find> factoryRuns(Deck deck) {
        List<String> tokens = deck.tokens();
        List<Find> finds = new ArrayList<>();
        int runStart = -1;
        for (int i = 0; i <= tokens.size(); i++) {
            boolean inPlace = i < tokens.size() && tokens.get(i).equals(Cards.FACTORY_ORDER.get(i));
            if (inPlace) {
                if (runStart < 0) runStart = i;
            } else if (runStart >= 0) {
                int len = i - runStart;
                if (len >= 4) {
                    finds.add(new Find(FACTORY_RUN, "Factory Run of " + len, "🏭", Rarity.EXTRAORDINARY, range(runStart, i)));
                }
                runStart = -1;
            }
        }
        return finds;
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    /** Splits [0, size) into maximal runs as {start, endExclusive} pairs. */
    private static List<int[]> maximalRuns(int size, Continues continues) {
        List<int[]> runs = new ArrayList<>();
        if (size == 0) return runs;
        int start = 0;
        for (int i = 1; i <= size; i++) {
            if (i == size || !continues.test(start, i)) {
                runs.add(new int[]{start, i});
                start = i;
            }
        }
        return runs;
    }

    static List<Integer> range(int from, int to) {
        List<Integer> out = new ArrayList<>(to - from);
        for (int k = from; k < to; k++) out.add(k);
        return out;
    }

    private static List<Find> withId(List<Find> finds, String id) {
        List<Find> out = new ArrayList<>();
        for (Find f : finds) {
            if (id.equals(f.id())) out.add(f);
        }
        return out;
    }

    private static List<Integer> allPositions(List<Find> finds) {
        List<Integer> out = new ArrayList<>();
        for (Find f : finds) out.addAll(f.positions());
        return out;
    }
}
