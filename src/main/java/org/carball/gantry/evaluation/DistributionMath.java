package org.carball.gantry.evaluation;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Small helpers over categorical count histograms.
 */
public final class DistributionMath {

    /**
     * Additive smoothing applied to every category of the union before normalizing, so that
     * categories missing from one side do not produce infinite divergence.
     */
    static final double SMOOTHING = 1e-4;

    private DistributionMath() {
    }

    /**
     * KL(p || q) over the union of keys, in nats.
     */
    public static <K> double klDivergence(Map<K, Integer> p, Map<K, Integer> q) {
        Set<K> keys = new LinkedHashSet<>(p.keySet());
        keys.addAll(q.keySet());
        if (keys.isEmpty()) {
            return 0.0;
        }
        Map<K, Double> pn = smoothed(p, keys);
        Map<K, Double> qn = smoothed(q, keys);
        double divergence = 0;
        for (K key : keys) {
            double pk = pn.get(key);
            divergence += pk * Math.log(pk / qn.get(key));
        }
        return Math.max(0.0, divergence);
    }

    /**
     * exp(-KL), in (0, 1]; 1 for identical distributions.
     */
    public static <K> double similarity(Map<K, Integer> generated, Map<K, Integer> reference) {
        return Math.exp(-klDivergence(generated, reference));
    }

    /**
     * Half the L1 distance between the normalized histograms, in [0, 1].
     */
    public static double totalVariation(int[] p, int[] q) {
        double pTotal = sum(p);
        double qTotal = sum(q);
        if (pTotal == 0 || qTotal == 0) {
            return pTotal == qTotal ? 0.0 : 1.0;
        }
        double distance = 0;
        for (int i = 0; i < Math.max(p.length, q.length); i++) {
            double pi = i < p.length ? p[i] / pTotal : 0;
            double qi = i < q.length ? q[i] / qTotal : 0;
            distance += Math.abs(pi - qi);
        }
        return distance / 2;
    }

    public static double clamp01(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static <K> Map<K, Double> smoothed(Map<K, Integer> counts, Set<K> keys) {
        double total = 0;
        for (K key : keys) {
            total += counts.getOrDefault(key, 0) + SMOOTHING;
        }
        Map<K, Double> normalized = new HashMap<>();
        for (K key : keys) {
            normalized.put(key, (counts.getOrDefault(key, 0) + SMOOTHING) / total);
        }
        return normalized;
    }

    private static double sum(int[] values) {
        double total = 0;
        for (int value : values) {
            total += value;
        }
        return total;
    }
}
