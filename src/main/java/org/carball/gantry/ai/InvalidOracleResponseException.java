package org.carball.gantry.ai;

/**
 * The oracle answered, but the answer is malformed or fails a local type or range check.
 */
public class InvalidOracleResponseException extends OracleException {

    public InvalidOracleResponseException(String message) {
        super(message);
    }

    public InvalidOracleResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
