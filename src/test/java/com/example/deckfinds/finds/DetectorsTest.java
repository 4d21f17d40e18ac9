package com.example.deckfinds.finds;

import com.example.deckfinds.TestDecks;
import com.example.deckfinds.model.Cards;
import com.example.deckfinds.model.Deck;
import com.example.deckfinds.model.Find;
import com.example.deckfinds.model.Rarity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DetectorsTest {

    private static Deck deck(String... prefix) {
        return Cards.deckOf(TestDecks.startingWith(prefix));
    }

    /** Finds whose positions start at {@code position}. */
    private static List<Find> startingAt(List<Find> finds, int position) {
        return finds.stream()
                .filter(f -> f.positions().get(0) == position)
                .collect(Collectors.toList());
    }

    private static Find single(List<Find> finds) {
        assertEquals(1, finds.size(), () -> "expected exactly one find but got " + finds);
        return finds.get(0);
    }

    // --- same rank ---

    @Test
    void sameRank_tripleIsReportedOnce() {
        Find f = single(startingAt(Detectors.sameRankGroups(deck("7♠", "7♥", "7♦", "2♣")), 0));
        assertEquals(FindIds.TRIPLE, f.id());
        assertEquals("Triple 7s", f.name());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertEquals(List.of(0, 1, 2), f.positions());
    }

    @Test
    void sameRank_quadBeatsTripleAndPair() {
        List<Find> finds = Detectors.sameRankGroups(deck("K♠", "K♥", "K♦", "K♣", "2♠"));
        Find f = single(startingAt(finds, 0));
        assertEquals(FindIds.QUAD, f.id());
        assertEquals("Quad Kings", f.name());
        assertEquals(Rarity.VERY_RARE, f.rarity());
        assertEquals(List.of(0, 1, 2, 3), f.positions());
        assertTrue(finds.stream().noneMatch(x -> x.positions().contains(1) && !x.id().equals(FindIds.QUAD)));
    }

    @Test
    void sameRank_pair() {
        Find f = single(startingAt(Detectors.sameRankGroups(deck("A♠", "A♥", "2♣")), 0));
        assertEquals(FindIds.PAIR, f.id());
        assertEquals("Pair of Aces", f.name());
        assertEquals(Rarity.COMMON, f.rarity());
    }

    @Test
    void scrambledDeck_hasNoSameRankGroups() {
        assertTrue(Detectors.sameRankGroups(Cards.deckOf(TestDecks.SCRAMBLED)).isEmpty());
    }

    // --- suited ---

    @Test
    void suitedStreak_ofFour() {
        Find f = single(startingAt(Detectors.suitedStreaks(deck("2♠", "5♠", "9♠", "J♠", "3♥")), 0));
        assertEquals(FindIds.SUITED_4, f.id());
        assertEquals("4 Spades", f.name());
        assertEquals("♠", f.icon());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertEquals(List.of(0, 1, 2, 3), f.positions());
    }

    @Test
    void suitedStreak_ofEightOrMore() {
        Find f = single(startingAt(Detectors.suitedStreaks(
                deck("A♠", "3♠", "5♠", "7♠", "9♠", "J♠", "K♠", "2♠", "4♥")), 0));
        assertEquals(FindIds.SUITED_8, f.id());
        assertEquals("8+ Spades", f.name());
        assertEquals(Rarity.EXTRAORDINARY, f.rarity());
        assertEquals(8, f.positions().size());
    }

    @Test
    void suitedStreak_tiersByLength() {
        assertEquals(FindIds.SUITED_3, single(startingAt(Detectors.suitedStreaks(deck("2♦", "6♦", "9♦", "3♣")), 0)).id());
        Find five = single(startingAt(Detectors.suitedStreaks(deck("2♦", "6♦", "9♦", "Q♦", "4♦", "3♣")), 0));
        assertEquals(FindIds.SUITED_5, five.id());
        assertEquals(Rarity.RARE, five.rarity());
        Find seven = single(startingAt(Detectors.suitedStreaks(
                deck("2♦", "6♦", "9♦", "Q♦", "4♦", "8♦", "K♦", "3♣")), 0));
        assertEquals(FindIds.SUITED_7, seven.id());
        assertEquals(Rarity.VERY_RARE, seven.rarity());
    }

    // --- runs ---

    @Test
    void rankRun_ofFour() {
        Find f = single(startingAt(Detectors.rankRuns(deck("4♠", "5♥", "6♦", "7♣", "9♠")), 0));
        assertEquals(FindIds.RUN_4, f.id());
        assertEquals("Run of 4", f.name());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertEquals(List.of(0, 1, 2, 3), f.positions());
    }

    @Test
    @DisplayName("An Ace right after a King extends the run as a high Ace")
    void rankRun_aceHighCompletesStraight() {
        Find f = single(startingAt(Detectors.rankRuns(deck("10♥", "J♦", "Q♣", "K♠", "A♥", "5♣")), 0));
        assertEquals(FindIds.STRAIGHT, f.id());
        assertEquals("Straight", f.name());
        assertEquals(Rarity.RARE, f.rarity());
        assertEquals(List.of(0, 1, 2, 3, 4), f.positions());
    }

    @Test
    void rankRun_closingAceIsNotReusedByTheNextRun() {
        List<Find> finds = Detectors.rankRuns(deck("Q♥", "K♠", "A♥", "2♣", "3♦", "9♠"));
        Find f = single(startingAt(finds, 0));
        assertEquals(FindIds.RUN_3, f.id());
        assertEquals(List.of(0, 1, 2), f.positions());
        assertTrue(finds.stream().noneMatch(x -> x.positions().contains(3)));
    }

    @Test
    void rankRun_longRunsAreVeryRare() {
        Find six = single(startingAt(Detectors.rankRuns(deck("3♠", "4♥", "5♦", "6♣", "7♠", "8♥", "K♦")), 0));
        assertEquals(FindIds.RUN_6, six.id());
        assertEquals(Rarity.VERY_RARE, six.rarity());

        Find eight = single(startingAt(Detectors.rankRuns(
                deck("3♠", "4♥", "5♦", "6♣", "7♠", "8♥", "9♣", "10♦", "2♥")), 0));
        assertEquals(FindIds.RUN_7, eight.id());
        assertEquals("Run of 8", eight.name());
    }

    // --- colours ---

    @Test
    void colourStreak_ofSixRed() {
        Find f = single(startingAt(Detectors.colourStreaks(deck("A♥", "3♦", "5♥", "7♦", "9♥", "J♦", "2♠")), 0));
        assertEquals(FindIds.COLOUR_6, f.id());
        assertEquals("Red Streak of 6", f.name());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertEquals(6, f.positions().size());
    }

    @Test
    void colourStreak_ofTenBlack() {
        Find f = single(startingAt(Detectors.colourStreaks(
                deck("A♠", "3♣", "5♠", "7♣", "9♠", "J♣", "K♠", "2♣", "4♠", "6♣", "8♥")), 0));
        assertEquals(FindIds.COLOUR_10, f.id());
        assertEquals("Black Streak of 10", f.name());
        assertEquals(Rarity.VERY_RARE, f.rarity());
    }

    @Test
    void colourStreak_ofSeven_isStillUncommon() {
        Find f = single(startingAt(Detectors.colourStreaks(
                deck("A♥", "3♦", "5♥", "7♦", "9♥", "J♦", "K♥", "2♠")), 0));
        assertEquals(FindIds.COLOUR_6, f.id());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertEquals(7, f.positions().size());
    }

    @Test
    void colourStreak_ofEight_isRare() {
        Find f = single(startingAt(Detectors.colourStreaks(
                deck("A♥", "3♦", "5♥", "7♦", "9♥", "J♦", "K♥", "2♦", "2♠")), 0));
        assertEquals(FindIds.COLOUR_8, f.id());
        assertEquals("Red Streak of 8", f.name());
        assertEquals(Rarity.RARE, f.rarity());
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7), f.positions());
    }

    @Test
    void colourStreak_ofNine_isRare() {
        Find f = single(startingAt(Detectors.colourStreaks(
                deck("A♥", "3♦", "5♥", "7♦", "9♥", "J♦", "K♥", "2♦", "4♥", "2♠")), 0));
        assertEquals(FindIds.COLOUR_8, f.id());
        assertEquals("Red Streak of 9", f.name());
        assertEquals(Rarity.RARE, f.rarity());
    }

    @Test
    void alternatingColours_ofSeven() {
        Find f = single(startingAt(Detectors.alternatingColours(
                deck("2♠", "9♥", "4♣", "J♦", "6♠", "K♥", "8♣", "10♣")), 0));
        assertEquals(FindIds.ALTERNATING_7, f.id());
        assertEquals("Alternating 7", f.name());
        assertEquals(Rarity.RARE, f.rarity());
        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6), f.positions());
    }

    @Test
    void alternatingColours_ofNine_isStillRare() {
        Find f = single(startingAt(Detectors.alternatingColours(
                deck("2♠", "9♥", "4♣", "J♦", "6♠", "K♥", "8♣", "3♦", "10♠", "10♣")), 0));
        assertEquals(FindIds.ALTERNATING_7, f.id());
        assertEquals("Alternating 9", f.name());
        assertEquals(Rarity.RARE, f.rarity());
    }

    @Test
    void alternatingColours_ofTen_isVeryRare() {
        Find f = single(startingAt(Detectors.alternatingColours(
                deck("2♠", "9♥", "4♣", "J♦", "6♠", "K♥", "8♣", "3♦", "10♠", "5♥", "7♥")), 0));
        assertEquals(FindIds.ALTERNATING_10, f.id());
        assertEquals("Alternating 10", f.name());
        assertEquals(Rarity.VERY_RARE, f.rarity());
        assertEquals(10, f.positions().size());
    }

    // --- blackjack ---

    @Test
    void blackjack_perfectSuitedAndPlain() {
        assertEquals(FindIds.PERFECT_BLACKJACK, single(startingAt(Detectors.blackjacks(deck("A♠", "J♠", "3♥")), 0)).id());
        assertEquals(FindIds.PERFECT_BLACKJACK, single(startingAt(Detectors.blackjacks(deck("J♠", "A♠", "3♥")), 0)).id());
        assertEquals(FindIds.SUITED_BLACKJACK, single(startingAt(Detectors.blackjacks(deck("K♥", "A♥", "3♣")), 0)).id());
        Find plain = single(startingAt(Detectors.blackjacks(deck("A♣", "10♦", "3♥")), 0));
        assertEquals(FindIds.BLACKJACK, plain.id());
        assertEquals(Rarity.COMMON, plain.rarity());
        assertEquals(List.of(0, 1), plain.positions());
    }

    @Test
    void blackjack_overlappingPairsAreAllReported() {
        List<Find> finds = Detectors.blackjacks(deck("K♥", "A♥", "Q♠", "3♣"));
        assertEquals(FindIds.SUITED_BLACKJACK, single(startingAt(finds, 0)).id());
        assertEquals(FindIds.BLACKJACK, single(startingAt(finds, 1)).id());
    }

    // --- counting ---

    @Test
    void countingFinds_threeOrMorePairs() {
        List<Find> groups = List.of(
                new Find(FindIds.PAIR, "Pair of 2s", "🃏", Rarity.COMMON, List.of(3, 4)),
                new Find(FindIds.TRIPLE, "Triple 5s", "🃏", Rarity.UNCOMMON, List.of(10, 11, 12)),
                new Find(FindIds.PAIR, "Pair of 9s", "🃏", Rarity.COMMON, List.of(20, 21)),
                new Find(FindIds.PAIR, "Pair of Kings", "🃏", Rarity.COMMON, List.of(40, 41)));

        Find f = single(Detectors.countingFinds(groups));
        assertEquals(FindIds.THREE_PAIRS, f.id());
        assertEquals("3 Pairs", f.name());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertEquals(List.of(3, 4, 20, 21, 40, 41), f.positions());
    }

    @Test
    void countingFinds_twoTriplesAndTwoQuads() {
        List<Find> groups = List.of(
                new Find(FindIds.TRIPLE, "Triple 5s", "🃏", Rarity.UNCOMMON, List.of(0, 1, 2)),
                new Find(FindIds.QUAD, "Quad 8s", "🃏", Rarity.VERY_RARE, List.of(10, 11, 12, 13)),
                new Find(FindIds.TRIPLE, "Triple Jacks", "🃏", Rarity.UNCOMMON, List.of(20, 21, 22)),
                new Find(FindIds.QUAD, "Quad 3s", "🃏", Rarity.VERY_RARE, List.of(30, 31, 32, 33)));

        Map<String, Find> byId = Detectors.countingFinds(groups).stream()
                .collect(Collectors.toMap(Find::id, f -> f));
        assertEquals(2, byId.size());
        assertEquals(Rarity.RARE, byId.get(FindIds.TWO_TRIPLES).rarity());
        assertEquals(List.of(0, 1, 2, 20, 21, 22), byId.get(FindIds.TWO_TRIPLES).positions());
        assertEquals(Rarity.EXTRAORDINARY, byId.get(FindIds.TWO_QUADS).rarity());
    }

    @Test
    void countingFinds_twoPairsAreNotEnough() {
        List<Find> groups = List.of(
                new Find(FindIds.PAIR, "Pair of 2s", "🃏", Rarity.COMMON, List.of(3, 4)),
                new Find(FindIds.PAIR, "Pair of 9s", "🃏", Rarity.COMMON, List.of(20, 21)));
        assertTrue(Detectors.countingFinds(groups).isEmpty());
    }

    // --- mirror ---

    @Test
    void mirror_threeSymmetricRankPairs() {
        Deck d = Cards.deckOf(TestDecks.with(Map.of(
                0, "5♠", 51, "5♥",
                1, "9♦", 50, "9♣",
                2, "Q♠", 49, "Q♥")));
        Find f = single(Detectors.mirror(d));
        assertEquals(FindIds.MIRROR, f.id());
        assertEquals(Rarity.UNCOMMON, f.rarity());
        assertTrue(f.positions().containsAll(List.of(0, 51, 1, 50, 2, 49)));
        assertEquals(f.positions().size() / 2 + " Mirrors", f.name());
    }

    @Test
    void mirror_standardDeckHasOnlyTwo() {
        assertTrue(Detectors.mirror(Cards.deckOf(Cards.STANDARD_DECK)).isEmpty());
    }

    // --- windows ---

    @Test
    void twoPair_needsTwoDifferentPairs() {
        Find f = single(startingAt(Detectors.twoPair(deck("4♠", "4♥", "J♦", "J♣", "2♠")), 0));
        assertEquals(FindIds.TWO_PAIR, f.id());
        assertEquals(List.of(0, 1, 2, 3), f.positions());

        assertTrue(startingAt(Detectors.twoPair(deck("4♠", "4♥", "4♦", "4♣", "2♠")), 0).isEmpty());
    }

    @Test
    void fullHouse_threeThenTwo() {
        Find f = single(startingAt(Detectors.fullHouse(deck("3♠", "3♥", "3♦", "9♣", "9♠", "K♥")), 0));
        assertEquals(FindIds.FULL_HOUSE, f.id());
        assertEquals(Rarity.VERY_RARE, f.rarity());
        assertEquals(List.of(0, 1, 2, 3, 4), f.positions());
    }

    @Test
    void fullHouse_twoThenThree() {
        assertEquals(1, startingAt(Detectors.fullHouse(deck("9♣", "9♠", "3♠", "3♥", "3♦", "K♥")), 0).size());
    }

    @Test
    void deadMansHand_anyOrderWithinFour() {
        Find f = single(Detectors.deadMansHand(deck("8♠", "A♥", "A♣", "8♦", "2♥")));
        assertEquals(FindIds.DEAD_MANS_HAND, f.id());
        assertEquals("Dead Man's Hand", f.name());
        assertEquals(List.of(0, 1, 2, 3), f.positions());
    }

    @Test
    void deadMansHand_spreadOverFiveIsNotEnough() {
        assertTrue(Detectors.deadMansHand(deck("A♠", "8♥", "2♣", "A♦", "8♣")).isEmpty());
    }

    // --- flushes ---

    @Test
    void straightFlush_fiveSuitedAscending() {
        Find f = single(startingAt(Detectors.straightFlushes(deck("9♣", "10♣", "J♣", "Q♣", "K♣", "2♥")), 0));
        assertEquals(FindIds.STRAIGHT_FLUSH, f.id());
        assertEquals(Rarity.EXTRAORDINARY, f.rarity());
        assertEquals(List.of(0, 1, 2, 3, 4), f.positions());
    }

    @Test
    void royalFlush_tenToAce() {
        Find f = single(startingAt(Detectors.straightFlushes(deck("10♥", "J♥", "Q♥", "K♥", "A♥", "2♣")), 0));
        assertEquals(FindIds.ROYAL_FLUSH, f.id());
        assertEquals("Royal Flush (Hearts)", f.name());
        assertEquals(Rarity.LEGENDARY, f.rarity());
        assertEquals(List.of(0, 1, 2, 3, 4), f.positions());
    }

    @Test
    void straightFlush_continuesPastAHighAce() {
        Find f = single(startingAt(Detectors.straightFlushes(deck("J♦", "Q♦", "K♦", "A♦", "2♦", "9♠")), 0));
        assertEquals(FindIds.STRAIGHT_FLUSH, f.id());
        assertEquals(5, f.positions().size());
    }

    @Test
    void straightFlush_fourIsTooShort() {
        assertTrue(startingAt(Detectors.straightFlushes(deck("9♣", "10♣", "J♣", "Q♣", "2♥")), 0).isEmpty());
    }

    // --- solitaire, top of deck ---

    @Test
    void solitaire_descendingAlternating() {
        Find f = single(startingAt(Detectors.solitaireRuns(deck("9♠", "8♥", "7♣", "6♦", "5♠", "5♥")), 0));
        assertEquals(FindIds.SOLITAIRE, f.id());
        assertEquals("Solitaire 5", f.name());
        assertEquals(Rarity.EXTRAORDINARY, f.rarity());
    }

    @Test
    void aceHigh_onlyForAceOfSpadesOnTop() {
        Find f = single(Detectors.aceHigh(Cards.deckOf(TestDecks.SCRAMBLED)));
        assertEquals(List.of(0), f.positions());
        assertEquals(Rarity.RARE, f.rarity());

        assertTrue(Detectors.aceHigh(deck("A♥")).isEmpty());
    }

    @Test
    void ascendingTopFive() {
        Find f = single(Detectors.ascendingTopFive(deck("2♠", "5♥", "9♦", "J♣", "K♠")));
        assertEquals(FindIds.ASCENDING_TOP_5, f.id());
        assertEquals(List.of(0, 1, 2, 3, 4), f.positions());

        assertTrue(Detectors.ascendingTopFive(deck("2♠", "5♥", "5♦", "J♣", "K♠")).isEmpty());
    }

    // --- factory ---

    @Test
    void factoryRun_blockStillInPlace() {
        Deck d = Cards.deckOf(TestDecks.with(Map.of(
                9, "2♥",
                10, "J♠", 11, "Q♠", 12, "K♠", 13, "A♦", 14, "2♦",
                15, "3♥")));
        Find f = single(Detectors.factoryRuns(d));
        assertEquals(FindIds.FACTORY_RUN, f.id());
        assertEquals("Factory Run of 5", f.name());
        assertEquals(List.of(10, 11, 12, 13, 14), f.positions());
    }

    @Test
    void factoryRun_wholeFactoryDeck() {
        Find f = single(Detectors.factoryRuns(Cards.deckOf(Cards.FACTORY_ORDER)));
        assertEquals("Factory Run of 52", f.name());
        assertEquals(52, f.positions().size());
    }
}
