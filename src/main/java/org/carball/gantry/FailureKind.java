package org.carball.gantry;

/**
 * Pipeline-level failure categories surfaced to callers.
 */
public enum FailureKind {
    CONFIGURATION,
    NOT_INITIALIZED,
    GENERATION
}
