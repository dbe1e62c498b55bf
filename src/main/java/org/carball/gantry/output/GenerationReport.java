package org.carball.gantry.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.gantry.model.evaluation.BenchmarkScore;
import org.carball.gantry.model.evaluation.DirectEvaluation;
import org.carball.gantry.model.evaluation.IndirectEvaluation;
import org.carball.gantry.model.output.GenerationBundle;
import org.carball.gantry.model.output.RunStatistics;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.GantryFields;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

@Slf4j
public class GenerationReport {

    private static final int PREVIEW_ROWS = 10;

    private final GenerationBundle bundle;
    private final LocalDateTime timestamp;
    private final ObjectMapper objectMapper;

    public GenerationReport(GenerationBundle bundle) {
        this.bundle = bundle;
        this.timestamp = LocalDateTime.now();

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(bundle);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        RunStatistics stats = bundle.statistics();

        md.append("# Gantry Transaction Synthesis Report\n\n");
        md.append("**Generated:** ").append(timestamp.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME)).append("  \n");
        md.append("**Oracle:** ").append(stats.getOracle()).append("  \n\n");

        md.append("## Run Overview\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Requested | ").append(stats.getRequested()).append(" |\n");
        md.append("| Attempts | ").append(stats.getAttempts()).append(" |\n");
        md.append("| Raw Records | ").append(stats.getRaw()).append(" |\n");
        md.append("| Accepted | ").append(stats.getAccepted()).append(" |\n");
        md.append("| Rejected | ").append(stats.getRejected()).append(" |\n");
        md.append("| Recovered | ").append(stats.getRecovered()).append(" |\n");
        md.append("| Elapsed | ").append(stats.getElapsedMillis()).append(" ms |\n");
        if (stats.isCancelled()) {
            md.append("| Cancelled | yes |\n");
        }
        if (stats.isTimedOut()) {
            md.append("| Timed Out | yes |\n");
        }
        md.append("\n");

        md.append("## Quality Tiers\n\n");
        md.append("| Tier | Weight | Records |\n");
        md.append("|------|--------|---------|\n");
        md.append("| 🟢 High | > 1.2 | ").append(bundle.qualityTiers().high().size()).append(" |\n");
        md.append("| 🟡 Medium | 0.8 - 1.2 | ").append(bundle.qualityTiers().medium().size()).append(" |\n");
        md.append("| 🔴 Low | < 0.8 | ").append(bundle.qualityTiers().low().size()).append(" |\n\n");

        appendEvaluation(md);
        appendFallbacks(md, stats);
        appendRejections(md, stats);
        appendScheduler(md, stats);
        appendPreview(md);

        return md.toString();
    }

    private void appendEvaluation(StringBuilder md) {
        DirectEvaluation direct = bundle.evaluation().direct();
        IndirectEvaluation indirect = bundle.evaluation().indirect();

        md.append("## Evaluation\n\n");
        if (direct.empty()) {
            md.append("No records were generated; all scores are zero.\n\n");
            return;
        }
        md.append("### Direct\n\n");
        md.append("| Score | Value |\n");
        md.append("|-------|-------|\n");
        md.append("| Faithfulness | ").append(percent(direct.faithfulness())).append(" |\n");
        md.append("| Diversity | ").append(percent(direct.diversity())).append(" |\n");
        md.append("| **Overall** | **").append(percent(direct.overall())).append("** |\n\n");

        Object benchmark = direct.details().get("benchmark");
        if (benchmark instanceof BenchmarkScore score && score.distributionSimilarity() != null) {
            md.append("**Benchmark similarity:** ").append(percent(score.overall()));
            md.append(" (distribution ").append(percent(score.distributionSimilarity()));
            if (score.statisticalSimilarity() != null) {
                md.append(", statistics ").append(percent(score.statisticalSimilarity()));
            }
            if (score.hourlyPatternSimilarity() != null) {
                md.append(", hourly ").append(percent(score.hourlyPatternSimilarity()));
            }
            if (score.correlationSimilarity() != null) {
                md.append(", correlation ").append(percent(score.correlationSimilarity()));
            }
            md.append(")\n\n");
        }

        md.append("### Indirect\n\n");
        md.append("| Task | Score |\n");
        md.append("|------|-------|\n");
        for (Map.Entry<String, Double> task : indirect.openEvaluation().entrySet()) {
            md.append("| ").append(task.getKey()).append(" | ").append(percent(task.getValue())).append(" |\n");
        }
        md.append("| **Overall** | **").append(percent(indirect.overall())).append("** |\n\n");
    }

    private void appendFallbacks(StringBuilder md, RunStatistics stats) {
        if (stats.getFallbackCounts() == null || stats.getFallbackCounts().isEmpty()) {
            return;
        }
        md.append("## Rule-Based Fallbacks\n\n");
        md.append("| Field Group | Count |\n");
        md.append("|-------------|-------|\n");
        stats.getFallbackCounts().forEach((group, n) ->
                md.append("| ").append(group).append(" | ").append(n).append(" |\n"));
        md.append("\n");
    }

    private void appendRejections(StringBuilder md, RunStatistics stats) {
        if (stats.getTopRejectionIssues() == null || stats.getTopRejectionIssues().isEmpty()) {
            return;
        }
        md.append("## Top Rejection Issues\n\n");
        stats.getTopRejectionIssues().forEach((issue, n) ->
                md.append("- ").append(issue).append(" (").append(n).append(")\n"));
        md.append("\n");
    }

    private void appendScheduler(StringBuilder md, RunStatistics stats) {
        if (stats.getScheduler() == null) {
            return;
        }
        md.append("## Category Distribution\n\n");
        md.append("| Dimension | Value | Target | Attempted | Accepted |\n");
        md.append("|-----------|-------|--------|-----------|----------|\n");
        stats.getScheduler().forEach((dimension, values) -> values.forEach((value, counts) ->
                md.append("| ").append(dimension)
                        .append(" | ").append(value)
                        .append(" | ").append(percent(counts.getOrDefault("target", 0).doubleValue()))
                        .append(" | ").append(counts.getOrDefault("attempted", 0))
                        .append(" | ").append(counts.getOrDefault("accepted", 0))
                        .append(" |\n")));
        md.append("\n");
    }

    private void appendPreview(StringBuilder md) {
        if (bundle.weightedSamples().isEmpty()) {
            return;
        }
        md.append("## Top Weighted Samples\n\n");
        md.append("| Transaction ID | Vehicle | Time | Fee (cents) | Mileage (m) | Weight |\n");
        md.append("|----------------|---------|------|-------------|-------------|--------|\n");
        bundle.weightedSamples().stream().limit(PREVIEW_ROWS).forEach(record -> appendRow(md, record));
        md.append("\n");
    }

    private static void appendRow(StringBuilder md, TransactionRecord record) {
        Double weight = record.getMetadata().getQualityWeight();
        md.append("| `").append(record.getId()).append("`")
                .append(" | ").append(record.get(GantryFields.VEHICLE_TYPE))
                .append(" | ").append(record.get(GantryFields.TRANSACTION_TIME))
                .append(" | ").append(record.get(GantryFields.PAY_FEE))
                .append(" | ").append(record.get(GantryFields.FEE_MILEAGE))
                .append(" | ").append(weight == null ? "-" : String.format("%.3f", weight))
                .append(" |\n");
    }

    private static String percent(double value) {
        return String.format("%.1f%%", value * 100);
    }
}
