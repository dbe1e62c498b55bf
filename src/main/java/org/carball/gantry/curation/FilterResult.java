package org.carball.gantry.curation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the sample filter for one record.
 *
 * @param score     mean of the sub-scores, in [0, 1]
 * @param subScores per check, in evaluation order
 * @param issues    human readable problems, empty for a clean record
 */
public record FilterResult(double score, Map<String, Double> subScores, List<String> issues) {

    public FilterResult {
        subScores = Collections.unmodifiableMap(new LinkedHashMap<>(subScores));
        issues = List.copyOf(issues);
    }

    public boolean passes(double threshold) {
        return score >= threshold;
    }
}
