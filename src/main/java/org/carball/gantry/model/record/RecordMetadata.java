package org.carball.gantry.model.record;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.carball.gantry.model.condition.GenerationCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Pipeline bookkeeping carried alongside a record's business fields.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecordMetadata {

    @JsonProperty("quality_score")
    private Double qualityScore;

    @JsonProperty("quality_weight")
    private Double qualityWeight;

    @JsonProperty("validation_issues")
    private List<String> validationIssues = new ArrayList<>();

    @JsonProperty("correction_log")
    private List<CorrectionEntry> correctionLog = new ArrayList<>();

    @JsonProperty("fallback_groups")
    private List<String> fallbackGroups = new ArrayList<>();

    @JsonProperty("sequence")
    private long sequence = -1;

    @JsonProperty("recovered")
    private boolean recovered;

    @JsonProperty("condition")
    private GenerationCondition condition;

    RecordMetadata copy() {
        RecordMetadata copy = new RecordMetadata();
        copy.qualityScore = qualityScore;
        copy.qualityWeight = qualityWeight;
        copy.validationIssues = new ArrayList<>(validationIssues);
        copy.correctionLog = new ArrayList<>(correctionLog);
        copy.fallbackGroups = new ArrayList<>(fallbackGroups);
        copy.sequence = sequence;
        copy.recovered = recovered;
        copy.condition = condition;
        return copy;
    }
}
