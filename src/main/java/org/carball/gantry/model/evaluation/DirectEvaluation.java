package org.carball.gantry.model.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record DirectEvaluation(
        @JsonProperty("faithfulness") double faithfulness,
        @JsonProperty("diversity") double diversity,
        @JsonProperty("overall") double overall,
        @JsonProperty("details") Map<String, Object> details,
        @JsonProperty("empty") boolean empty
) {

    public static DirectEvaluation emptyResult() {
        return new DirectEvaluation(0.0, 0.0, 0.0, Map.of(), true);
    }
}
