package com.polyexplorer.core.error;

import java.util.Objects;

/**
 * Top-level failure: exactly one stage failure, tagged by the stage that produced it. Promotion
 * is a plain wrap, so {@link #failure()} returns the very value that was promoted.
 */
public sealed interface PipelineFailure {

    Stage stage();

    StageFailure failure();

    default String message() {
        return stage().label() + ": " + failure().message();
    }

    static PipelineFailure of(StageFailure failure) {
        return Objects.requireNonNull(failure, "failure must not be null").promote();
    }

    record Http(TransportFailure failure) implements PipelineFailure {
        public Http {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public Stage stage() {
            return Stage.HTTP;
        }
    }

    record DataSource(SourceFailure failure) implements PipelineFailure {
        public DataSource {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public Stage stage() {
            return Stage.DATA_SOURCE;
        }
    }

    record Parse(ParseFailure failure) implements PipelineFailure {
        public Parse {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public Stage stage() {
            return Stage.PARSE;
        }
    }

    record Normalization(NormalizationFailure failure) implements PipelineFailure {
        public Normalization {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public Stage stage() {
            return Stage.NORMALIZATION;
        }
    }

    record Analysis(AnalysisFailure failure) implements PipelineFailure {
        public Analysis {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public Stage stage() {
            return Stage.ANALYSIS;
        }
    }

    record Output(OutputFailure failure) implements PipelineFailure {
        public Output {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public Stage stage() {
            return Stage.OUTPUT;
        }
    }
}
