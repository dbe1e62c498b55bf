package org.carball.gantry.curation;

import org.carball.gantry.model.record.TransactionRecord;

import java.util.List;

public record FilterOutcome(List<TransactionRecord> accepted, List<TransactionRecord> rejected) {

    public FilterOutcome {
        accepted = List.copyOf(accepted);
        rejected = List.copyOf(rejected);
    }
}
