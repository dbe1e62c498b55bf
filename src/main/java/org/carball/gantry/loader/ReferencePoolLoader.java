package org.carball.gantry.loader;

import org.carball.gantry.model.record.TransactionRecord;

import java.io.IOException;
import java.util.List;

/**
 * Source of real transaction records, used both as the training pool and the benchmark pool.
 */
public interface ReferencePoolLoader {

    /**
     * @param limit maximum number of records to return; zero or negative means no limit
     */
    List<TransactionRecord> load(int limit) throws IOException;
}
