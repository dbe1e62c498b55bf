package org.carball.gantry.generation;

import org.carball.gantry.model.condition.GenerationCondition;
import org.carball.gantry.model.record.TransactionRecord;
import org.carball.gantry.model.schema.FieldGroup;

import java.util.Random;

/**
 * One field group to produce for a record in progress. {@code random} is private to the record.
 */
public record GroupRequest(
        FieldGroup group,
        GenerationCondition condition,
        TransactionRecord partial,
        long sequence,
        Random random
) {
}
