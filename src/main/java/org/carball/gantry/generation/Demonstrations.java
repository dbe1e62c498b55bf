package org.carball.gantry.generation;

import org.carball.gantry.model.record.TransactionRecord;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Demonstration sets chosen for one record. With a single set there is nothing to resolve; with
 * several, {@link #resolve()} picks one by majority vote.
 */
public final class Demonstrations {

    private static final Demonstrations NONE = new Demonstrations(List.of());

    private final List<List<TransactionRecord>> candidateSets;

    private Demonstrations(List<List<TransactionRecord>> candidateSets) {
        this.candidateSets = candidateSets.stream().map(List::copyOf).toList();
    }

    public static Demonstrations none() {
        return NONE;
    }

    public static Demonstrations single(List<TransactionRecord> demonstrations) {
        return new Demonstrations(List.of(demonstrations));
    }

    public static Demonstrations candidates(List<List<TransactionRecord>> candidateSets) {
        return new Demonstrations(candidateSets);
    }

    public List<List<TransactionRecord>> getCandidateSets() {
        return candidateSets;
    }

    /**
     * Each set scores the sum, over its members, of how many sets contain that member. The highest
     * score wins; on a tie the earliest selected set wins.
     */
    public List<TransactionRecord> resolve() {
        if (candidateSets.isEmpty()) {
            return List.of();
        }
        if (candidateSets.size() == 1) {
            return candidateSets.get(0);
        }
        Map<TransactionRecord, Integer> appearances = new IdentityHashMap<>();
        for (List<TransactionRecord> set : candidateSets) {
            for (TransactionRecord member : set.stream().distinct().toList()) {
                appearances.merge(member, 1, Integer::sum);
            }
        }
        List<TransactionRecord> best = candidateSets.get(0);
        int bestScore = -1;
        for (List<TransactionRecord> set : candidateSets) {
            int score = 0;
            for (TransactionRecord member : set) {
                score += appearances.get(member);
            }
            if (score > bestScore) {
                best = set;
                bestScore = score;
            }
        }
        return best;
    }
}
