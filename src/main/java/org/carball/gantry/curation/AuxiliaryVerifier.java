package org.carball.gantry.curation;

import org.carball.gantry.model.record.TransactionRecord;

import java.util.List;

/**
 * Optional second opinion on curated records, e.g. a learned classifier or a GAN discriminator.
 * Implementations return corrected copies and explain every change in the correction log.
 */
public interface AuxiliaryVerifier {

    List<TransactionRecord> verify(List<TransactionRecord> records);
}
