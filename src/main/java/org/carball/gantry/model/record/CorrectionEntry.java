package org.carball.gantry.model.record;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One logged change to a record. For oracle fallbacks {@code field} names the group.
 */
public record CorrectionEntry(
        @JsonProperty("field") String field,
        @JsonProperty("old") Object oldValue,
        @JsonProperty("new") Object newValue,
        @JsonProperty("reason") String reason
) {
}
