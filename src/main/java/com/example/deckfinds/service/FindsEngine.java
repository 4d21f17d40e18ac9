package com.example.deckfinds.service;

import com.example.deckfinds.finds.Detectors;
import com.example.deckfinds.finds.Reconciler;
import com.example.deckfinds.model.Cards;
import com.example.deckfinds.model.Deck;
import com.example.deckfinds.model.Find;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

/**
 * Finds engine: validates a shuffled deck, runs the detector catalogue, reconciles the candidates
 * and returns them rarest first. Stateless; safe to call concurrently.
 */
@Service
public class FindsEngine {

    private static final Logger log = LoggerFactory.getLogger(FindsEngine.class);

    /**
     * The catalogue in concatenation order, minus the counting finds which are derived from the
     * same-rank groups and slotted in after the blackjacks.
     */
    private static final List<Function<Deck, List<Find>>> BEFORE_COUNTING = List.of(
            Detectors::suitedStreaks,
            Detectors::rankRuns,
            Detectors::colourStreaks,
            Detectors::alternatingColours,
            Detectors::blackjacks
    );

    private static final List<Function<Deck, List<Find>>> AFTER_COUNTING = List.of(
            Detectors::mirror,
            Detectors::twoPair,
            Detectors::fullHouse,
            Detectors::straightFlushes,
            Detectors::deadMansHand,
            Detectors::solitaireRuns,
            Detectors::aceHigh,
            Detectors::ascendingTopFive,
            Detectors::factoryRuns
    );

    /** Rarity declares its tiers rarest first; List.sort keeps equal tiers in candidate order. */
    private static final Comparator<Find> RAREST_FIRST = Comparator.comparing(Find::rarity);

    private final NoveltyCheck noveltyCheck;

    /** Default ctor for tests (no Spring context): every find is new. */
    public FindsEngine() {
        this.noveltyCheck = new AlwaysNewNoveltyCheck();
    }

    @Autowired
    public FindsEngine(ObjectProvider<NoveltyCheck> noveltyCheckProvider) {
        NoveltyCheck nc = (noveltyCheckProvider != null ? noveltyCheckProvider.getIfAvailable() : null);
        this.noveltyCheck = (nc != null ? nc : new AlwaysNewNoveltyCheck());
    }

    public FindsEngine(NoveltyCheck noveltyCheck) {
        this.noveltyCheck = (noveltyCheck != null ? noveltyCheck : new AlwaysNewNoveltyCheck());
    }

    /**
     * Detect the finds in {@code tokens} and attach the novelty flag.
     *
     * @throws com.example.deckfinds.model.InvalidDeckException if the tokens are not a 52-card permutation
     */
    public List<ReportedFind> detect(List<String> tokens) {
        List<Find> finds = findAll(tokens);
        List<ReportedFind> out = new ArrayList<>(finds.size());
        for (Find f : finds) {
            out.add(new ReportedFind(f, noveltyCheck.isNew(f)));
        }
        return out;
    }

    /** Validation, detection and reconciliation without any viewer-dependent data. */
    public List<Find> findAll(List<String> tokens) {
        Deck deck = Cards.deckOf(tokens);
        List<Find> candidates = candidates(deck);
        List<Find> finds = Reconciler.reconcile(candidates);
        finds.sort(RAREST_FIRST);
        log.debug("Deck {}: {} candidate finds, {} after reconciliation", deck, candidates.size(), finds.size());
        return finds;
    }

    /** Every detector's raw output, concatenated in catalogue order. */
    static List<Find> candidates(Deck deck) {
        List<Find> sameRank = Detectors.sameRankGroups(deck);

        List<Find> all = new ArrayList<>(sameRank);
        for (Function<Deck, List<Find>> detector : BEFORE_COUNTING) {
            all.addAll(detector.apply(deck));
        }
        all.addAll(Detectors.countingFinds(sameRank));
        for (Function<Deck, List<Find>> detector : AFTER_COUNTING) {
            all.addAll(detector.apply(deck));
        }
        return all;
    }
}
