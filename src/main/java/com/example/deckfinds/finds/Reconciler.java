package com.example.deckfinds.finds;

import com.example.deckfinds.model.Find;

import java.util.*;

import static com.example.deckfinds.finds.FindIds.*;

/**
 * Turns raw candidate finds into the reported set: counting finds absorb their members, higher
 * finds suppress the overlapping finds they imply, and each id is kept once.
 */
public final class Reconciler {

    private Reconciler() {}

    /** A winner id and the ids it removes wherever their positions overlap a surviving winner. */
    public record SuppressionRule(String winner, Set<String> losers) {
        public SuppressionRule {
            losers = Set.copyOf(losers);
        }
    }

    private static final List<String> FLUSH_LOSERS;

    static {
        List<String> l = new ArrayList<>(List.of(STRAIGHT, RUN_6, RUN_7));
        l.addAll(SUITED);
        FLUSH_LOSERS = List.copyOf(l);
    }

    /** Applied in this order. */
    public static final List<SuppressionRule> SUPPRESSION_RULES = List.of(
            new SuppressionRule(ROYAL_FLUSH, union(Set.of(STRAIGHT_FLUSH), FLUSH_LOSERS)),
            new SuppressionRule(STRAIGHT_FLUSH, new HashSet<>(FLUSH_LOSERS)),
            new SuppressionRule(PERFECT_BLACKJACK, Set.of(SUITED_BLACKJACK, BLACKJACK)),
            new SuppressionRule(SUITED_BLACKJACK, Set.of(BLACKJACK)),
            new SuppressionRule(TWO_QUADS, Set.of(TWO_TRIPLES))
    );

    /** Counting find id → the member id it absorbs. */
    private static final Map<String, String> AGGREGATES = Map.of(
            THREE_PAIRS, PAIR,
            TWO_TRIPLES, TRIPLE,
            TWO_QUADS, QUAD
    );

    public static List<Find> reconcile(List<Find> candidates) {
        List<Find> filtered = absorbAggregateMembers(candidates);
        filtered = applySuppressionRules(filtered);
        return keepBestPerId(filtered);
    }

    static List<Find> absorbAggregateMembers(List<Find> finds) {
        Set<String> absorbed = new HashSet<>();
        for (Find f : finds) {
            String member = AGGREGATES.get(f.id());
            if (member != null) absorbed.add(member);
        }
        if (absorbed.isEmpty()) return new ArrayList<>(finds);

        List<Find> out = new ArrayList<>(finds.size());
        for (Find f : finds) {
            if (!absorbed.contains(f.id())) out.add(f);
        }
        return out;
    }

    static List<Find> applySuppressionRules(List<Find> finds) {
        List<Find> filtered = new ArrayList<>(finds);
        for (SuppressionRule rule : SUPPRESSION_RULES) {
            List<Find> winners = new ArrayList<>();
            for (Find f : filtered) {
                if (rule.winner().equals(f.id())) winners.add(f);
            }
            if (winners.isEmpty()) continue;

            filtered.removeIf(f -> rule.losers().contains(f.id())
                    && winners.stream().anyMatch(w -> w.overlaps(f)));
        }
        return filtered;
    }

    /**
     * One find per id: the one covering the most positions. On a tie the earlier candidate stays.
     * Ids keep the order of their first appearance.
     */
    static List<Find> keepBestPerId(List<Find> finds) {
        LinkedHashMap<String, Find> best = new LinkedHashMap<>();
        for (Find f : finds) {
            Find existing = best.get(f.id());
            if (existing == null || f.positions().size() > existing.positions().size()) {
                best.put(f.id(), f);
            }
        }
        return new ArrayList<>(best.values());
    }

    private static Set<String> union(Set<String> a, Collection<String> b) {
        Set<String> out = new HashSet<>(a);
        out.addAll(b);
        return out;
    }
}
