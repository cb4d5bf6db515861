package com.polyexplorer.core.error;

/**
 * A failure detected inside one pipeline stage. The set of stage types is closed; each stage type
 * is itself a closed set of immutable records.
 */
public sealed interface StageFailure
        permits TransportFailure, SourceFailure, ParseFailure, NormalizationFailure, AnalysisFailure, OutputFailure {

    Stage stage();

    /** Deterministic human-readable rendering of every field of the failure. */
    String message();

    /** Wraps this failure into the matching {@link PipelineFailure} variant without altering it. */
    PipelineFailure promote();
}
