package org.carball.gantry.loader;

import org.carball.gantry.model.record.TransactionRecord;

import java.util.ArrayList;
import java.util.List;

public class InMemoryReferencePoolLoader implements ReferencePoolLoader {

    private final List<TransactionRecord> records;

    public InMemoryReferencePoolLoader(List<TransactionRecord> records) {
        this.records = List.copyOf(records);
    }

    @Override
    public List<TransactionRecord> load(int limit) {
        if (limit <= 0 || limit >= records.size()) {
            return new ArrayList<>(records);
        }
        return new ArrayList<>(records.subList(0, limit));
    }
}
