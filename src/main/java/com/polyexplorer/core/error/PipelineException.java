package com.polyexplorer.core.error;

/**
 * Carries a promoted {@link PipelineFailure} up the call stack. The stage failure is promoted when
 * the exception is created, i.e. the moment it leaves the stage that detected it. The optional
 * cause is the low-level exception that triggered detection.
 */
public class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient PipelineFailure failure;

    public PipelineException(StageFailure failure) {
        this(PipelineFailure.of(failure), null);
    }

    public PipelineException(StageFailure failure, Throwable cause) {
        this(PipelineFailure.of(failure), cause);
    }

    private PipelineException(PipelineFailure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public PipelineFailure failure() {
        return failure;
    }

    public Stage stage() {
        return failure.stage();
    }
}
