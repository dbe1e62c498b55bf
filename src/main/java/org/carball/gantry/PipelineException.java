package org.carball.gantry;

/**
 * Fatal, pipeline-level problem: bad configuration, an uninitialized pipeline or a run
 * that accepted nothing. Stage-local problems never surface as this exception.
 */
public class PipelineException extends RuntimeException {

    private final FailureKind kind;

    public PipelineException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PipelineException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }

    public static PipelineException configuration(String message) {
        return new PipelineException(FailureKind.CONFIGURATION, message);
    }
}
