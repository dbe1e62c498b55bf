package org.carball.gantry.model.evaluation;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EvaluationResult(
        @JsonProperty("direct") DirectEvaluation direct,
        @JsonProperty("indirect") IndirectEvaluation indirect
) {
}
