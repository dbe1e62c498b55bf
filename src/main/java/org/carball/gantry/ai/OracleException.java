package org.carball.gantry.ai;

/**
 * The oracle could not produce an answer. Always recoverable: the caller falls back to rules.
 */
public class OracleException extends Exception {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
