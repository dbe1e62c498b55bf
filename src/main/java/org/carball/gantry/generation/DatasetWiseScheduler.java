package org.carball.gantry.generation;

import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.condition.Scenario;
import org.carball.gantry.model.condition.TimePeriod;
import org.carball.gantry.model.condition.VehicleCategory;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;
import org.carball.gantry.model.stats.TargetDistribution;
import org.carball.gantry.reference.VehicleClassifier;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;

/**
 * Chooses the next generation condition so that accepted records follow the target distribution.
 *
 * <p>Each dimension is scheduled independently: the value with the largest positive gap between
 * target share and accepted share wins, ties going to the earlier enum constant. When no gap is
 * positive the value is drawn in proportion to the target. Attempted counts are kept for retry
 * policy and reporting only.
 */
@Slf4j
public class DatasetWiseScheduler {

    private static final int EXHAUSTED_REDRAWS = 8;

    private final TargetDistribution target;
    private final VehicleClassifier classifier;
    private final SectionDateMapper dateMapper;
    private final Random random;

    private final Dimension<VehicleCategory> vehicle;
    private final Dimension<TimePeriod> time;
    private final Dimension<Scenario> scenario;
    private final Map<String, Integer> rejectedByCondition = new HashMap<>();

    public DatasetWiseScheduler(TargetDistribution target, VehicleClassifier classifier,
                                SectionDateMapper dateMapper, long seed) {
        this.target = target;
        this.classifier = classifier;
        this.dateMapper = dateMapper;
        this.random = new Random(seed);
        this.vehicle = new Dimension<>(VehicleCategory.class, target.getVehicle());
        this.time = new Dimension<>(TimePeriod.class, target.getTime());
        this.scenario = new Dimension<>(Scenario.class, target.getScenario());
    }

    public synchronized GenerationCondition nextCondition() {
        return nextCondition(Set.of());
    }

    /**
     * Like {@link #nextCondition()}, but conditions whose key is in {@code exhausted} are avoided by
     * drawing proportionally to the target instead, when such a draw finds another condition.
     */
    public synchronized GenerationCondition nextCondition(Set<String> exhausted) {
        LocalDateTime baseTime = dateMapper.anyDate(random).atStartOfDay();
        GenerationCondition condition = new GenerationCondition(
                vehicle.byGap(random), time.byGap(random), scenario.byGap(random), baseTime);

        for (int i = 0; i < EXHAUSTED_REDRAWS && exhausted.contains(condition.key()); i++) {
            condition = new GenerationCondition(
                    vehicle.proportional(random), time.proportional(random), scenario.proportional(random), baseTime);
        }
        log.debug("Next condition: {}", condition.key());
        return condition;
    }

    /**
     * Records the outcome of one attempt.
     */
    public synchronized void update(TransactionRecord record, boolean accepted) {
        GenerationCondition origin = record.getMetadata().getCondition();
        VehicleCategory category = labelOr(record, GantryFields.VEHICLE_CATEGORY, VehicleCategory::fromWireName,
                classifier.category(record), origin == null ? null : origin.vehicleCategory());
        TimePeriod period = labelOr(record, GantryFields.TIME_PERIOD, TimePeriod::fromWireName,
                classifier.timePeriod(record), origin == null ? null : origin.timePeriod());
        Scenario kind = labelOr(record, GantryFields.SCENARIO, Scenario::fromWireName,
                classifier.scenario(record), origin == null ? null : origin.scenario());

        vehicle.count(category, accepted);
        time.count(period, accepted);
        scenario.count(kind, accepted);

        if (!accepted && origin != null) {
            rejectedByCondition.merge(origin.key(), 1, Integer::sum);
        }
    }

    /**
     * Counts a record accepted after a rejected attempt was repaired; its attempt is already counted.
     */
    public synchronized void recordRecovery(TransactionRecord record) {
        vehicle.count(classifier.category(record), true, false);
        time.count(classifier.timePeriod(record), true, false);
        scenario.count(classifier.scenario(record), true, false);
    }

    public synchronized int rejectedCount(GenerationCondition condition) {
        return rejectedByCondition.getOrDefault(condition.key(), 0);
    }

    /**
     * Per dimension and value: target share, attempted and accepted counts.
     */
    public synchronized Map<String, Map<String, Map<String, Number>>> snapshot() {
        Map<String, Map<String, Map<String, Number>>> snapshot = new LinkedHashMap<>();
        snapshot.put("vehicle", vehicle.snapshot(VehicleCategory::getWireName));
        snapshot.put("time", time.snapshot(TimePeriod::getWireName));
        snapshot.put("scenario", scenario.snapshot(Scenario::getWireName));
        return snapshot;
    }

    public TargetDistribution getTarget() {
        return target;
    }

    private static <E extends Enum<E>> E labelOr(TransactionRecord record, String label,
                                                 Function<String, E> parser,
                                                 E classified, E fallback) {
        String value = record.getString(label);
        if (value != null) {
            try {
                return parser.apply(value);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring unparseable label {}={}", label, value);
            }
        }
        return classified != null ? classified : fallback;
    }

    private static final class Dimension<E extends Enum<E>> {

        private final E[] values;
        private final Map<E, Double> target;
        private final Map<E, Integer> attempted;
        private final Map<E, Integer> accepted;
        private int acceptedTotal;

        Dimension(Class<E> type, Map<E, Double> target) {
            this.values = type.getEnumConstants();
            this.target = target;
            this.attempted = new EnumMap<>(type);
            this.accepted = new EnumMap<>(type);
        }

        E byGap(Random random) {
            E best = null;
            double bestGap = 0;
            for (E value : values) {
                double share = acceptedTotal == 0 ? 0 : accepted.getOrDefault(value, 0) / (double) acceptedTotal;
                double gap = target.getOrDefault(value, 0.0) - share;
                if (gap > bestGap) {
                    best = value;
                    bestGap = gap;
                }
            }
            return best != null ? best : proportional(random);
        }

        E proportional(Random random) {
            double roll = random.nextDouble();
            double cumulative = 0;
            E last = null;
            for (E value : values) {
                double share = target.getOrDefault(value, 0.0);
                if (share <= 0) {
                    continue;
                }
                cumulative += share;
                last = value;
                if (roll < cumulative) {
                    return value;
                }
            }
            return last != null ? last : values[0];
        }

        void count(E value, boolean wasAccepted) {
            count(value, wasAccepted, true);
        }

        void count(E value, boolean wasAccepted, boolean newAttempt) {
            if (value == null) {
                return;
            }
            if (newAttempt) {
                attempted.merge(value, 1, Integer::sum);
            }
            if (wasAccepted) {
                accepted.merge(value, 1, Integer::sum);
                acceptedTotal++;
            }
        }

        Map<String, Map<String, Number>> snapshot(Function<E, String> naming) {
            Map<String, Map<String, Number>> snapshot = new LinkedHashMap<>();
            for (E value : values) {
                Map<String, Number> counts = new LinkedHashMap<>();
                counts.put("target", target.getOrDefault(value, 0.0));
                counts.put("attempted", attempted.getOrDefault(value, 0));
                counts.put("accepted", accepted.getOrDefault(value, 0));
                snapshot.put(naming.apply(value), counts);
            }
            return snapshot;
        }
    }
}
