package org.carball.gantry.ai;

import java.util.Map;

/**
 * External text generator asked for one field group at a time. Implementations return the
 * parsed JSON object of the answer; its values are still untyped.
 */
public interface TextGenerationOracle {

    Map<String, Object> generate(String prompt) throws OracleException;

    /**
     * Short name used in logs and run statistics.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
