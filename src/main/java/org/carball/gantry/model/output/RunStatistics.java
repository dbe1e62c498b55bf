package org.carball.gantry.model.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Counters and flags describing how a generation run went.
 */
@Data
@Builder
public class RunStatistics {

    @JsonProperty("requested")
    private int requested;

    @JsonProperty("attempts")
    private int attempts;

    @JsonProperty("raw")
    private int raw;

    @JsonProperty("accepted")
    private int accepted;

    @JsonProperty("rejected")
    private int rejected;

    @JsonProperty("recovered")
    private int recovered;

    /** Rule-based fallbacks per field group. */
    @JsonProperty("fallback_counts")
    private Map<String, Integer> fallbackCounts;

    /** Most frequent filter issues among rejected records, most frequent first. */
    @JsonProperty("top_rejection_issues")
    private Map<String, Integer> topRejectionIssues;

    @JsonProperty("scheduler")
    private Map<String, Map<String, Map<String, Number>>> scheduler;

    @JsonProperty("cancelled")
    private boolean cancelled;

    @JsonProperty("timed_out")
    private boolean timedOut;

    @JsonProperty("elapsed_millis")
    private long elapsedMillis;

    @JsonProperty("oracle")
    private String oracle;
}
