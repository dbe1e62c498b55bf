package org.carball.gantry.ai;

import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.record.TransactionRecord;

import java.time.LocalDate;
import java.util.List;

/**
 * Everything a group prompt may refer to. {@code samplingDate} and {@code mileageHint} are
 * optional hints (null when unknown).
 */
public record PromptContext(
        GenerationCondition condition,
        TransactionRecord partial,
        List<TransactionRecord> demonstrations,
        LocalDate samplingDate,
        Long mileageHint
) {

    public PromptContext {
        demonstrations = demonstrations == null ? List.of() : List.copyOf(demonstrations);
    }
}
