package org.carball.gantry.generation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * Few-shot demonstration selection from the reference pool, plus a bounded pool of high quality
 * generated records (self-instruct feedback). The reference pool itself is never modified.
 *
 * <p>Only called from the orchestrator thread.
 */
@Slf4j
public class DemonstrationSelector {

    static final double VEHICLE_WEIGHT = 0.4;
    static final double SCENARIO_WEIGHT = 0.3;
    static final double PERIOD_WEIGHT = 0.3;

    private static final Comparator<LocalDateTime> NEWEST_FIRST =
            Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder());

    private final List<Candidate> pool;
    private final Deque<Candidate> feedback = new ArrayDeque<>();
    private final VehicleClassifier classifier;
    private final int feedbackCapacity;
    private int nextOrder;

    public DemonstrationSelector(List<TransactionRecord> referencePool, VehicleClassifier classifier, int feedbackCapacity) {
        this.classifier = classifier;
        this.feedbackCapacity = Math.max(0, feedbackCapacity);
        List<Candidate> candidates = new ArrayList<>(referencePool.size());
        for (TransactionRecord record : referencePool) {
            candidates.add(describe(record));
        }
        this.pool = List.copyOf(candidates);
    }

    /**
     * Up to {@code k} records ranked by condition match, newest transaction first on equal match,
     * then pool order.
     */
    public List<TransactionRecord> select(GenerationCondition condition, int k) {
        List<Scored> scored = score(condition);
        scored.sort(Comparator.comparingDouble(Scored::score).reversed()
                .thenComparing(Scored::time, NEWEST_FIRST)
                .thenComparingInt(Scored::order));
        return top(scored, k);
    }

    /**
     * {@code n} candidate sets of up to {@code k} records each. Records with equal match score are
     * ordered by a draw from {@code random}, so sets differ only among ties.
     */
    public Demonstrations selectCandidates(GenerationCondition condition, int k, int n, Random random) {
        if (n <= 1) {
            return Demonstrations.single(select(condition, k));
        }
        List<List<TransactionRecord>> sets = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            List<Scored> scored = score(condition);
            List<Scored> keyed = new ArrayList<>(scored.size());
            for (Scored entry : scored) {
                keyed.add(entry.withTieBreak(random.nextDouble()));
            }
            keyed.sort(Comparator.comparingDouble(Scored::score).reversed()
                    .thenComparingDouble(Scored::tieBreak));
            sets.add(top(keyed, k));
        }
        return Demonstrations.candidates(sets);
    }

    /**
     * Makes a generated record eligible as a demonstration; the oldest feedback record is evicted
     * when the pool is full.
     */
    public void addFeedback(TransactionRecord record) {
        if (feedbackCapacity == 0) {
            return;
        }
        if (feedback.size() >= feedbackCapacity) {
            feedback.removeFirst();
        }
        feedback.addLast(describe(record));
        log.debug("Feedback pool holds {} generated records", feedback.size());
    }

    public int feedbackSize() {
        return feedback.size();
    }

    public int poolSize() {
        return pool.size();
    }

    private List<Scored> score(GenerationCondition condition) {
        List<Scored> scored = new ArrayList<>(pool.size() + feedback.size());
        for (Candidate candidate : pool) {
            scored.add(new Scored(candidate, match(candidate, condition), 0));
        }
        for (Candidate candidate : feedback) {
            scored.add(new Scored(candidate, match(candidate, condition), 0));
        }
        return scored;
    }

    static double match(Candidate candidate, GenerationCondition condition) {
        double score = 0;
        if (candidate.category() == condition.vehicleCategory()) {
            score += VEHICLE_WEIGHT;
        }
        if (candidate.scenario() == condition.scenario()) {
            score += SCENARIO_WEIGHT;
        }
        if (candidate.period() == condition.timePeriod()) {
            score += PERIOD_WEIGHT;
        }
        return score;
    }

    private static List<TransactionRecord> top(List<Scored> ranked, int k) {
        List<TransactionRecord> selected = new ArrayList<>(Math.max(0, k));
        for (int i = 0; i < ranked.size() && selected.size() < k; i++) {
            selected.add(ranked.get(i).candidate().record());
        }
        return selected;
    }

    private Candidate describe(TransactionRecord record) {
        return new Candidate(record,
                classifier.category(record),
                classifier.timePeriod(record),
                classifier.scenario(record),
                record.getTime(GantryFields.TRANSACTION_TIME),
                nextOrder++);
    }

    record Candidate(TransactionRecord record, VehicleCategory category, TimePeriod period,
                     Scenario scenario, LocalDateTime time, int order) {
    }

    private record Scored(Candidate candidate, double score, double tieBreak) {

        LocalDateTime time() {
            return candidate.time();
        }

        int order() {
            return candidate.order();
        }

        Scored withTieBreak(double draw) {
            return new Scored(candidate, score, draw);
        }
    }
}
