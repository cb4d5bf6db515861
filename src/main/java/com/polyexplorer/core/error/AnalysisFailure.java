package com.polyexplorer.core.error;

import java.time.Duration;

public sealed interface AnalysisFailure extends StageFailure {

    @Override
    default Stage stage() {
        return Stage.ANALYSIS;
    }

    @Override
    default PipelineFailure promote() {
        return new PipelineFailure.Analysis(this);
    }

    record InsufficientData(String analysisType, String reason) implements AnalysisFailure {
        public InsufficientData {
            Fields.required(analysisType, "analysisType");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Insufficient data for " + analysisType + " analysis: " + reason;
        }
    }

    record CalculationFailed(String analysisType, String reason) implements AnalysisFailure {
        public CalculationFailed {
            Fields.required(analysisType, "analysisType");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return analysisType + " calculation failed: " + reason;
        }
    }

    record InvalidPosition(String positionId, String reason) implements AnalysisFailure {
        public InvalidPosition {
            Fields.required(positionId, "positionId");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid position '" + positionId + "': " + reason;
        }
    }

    record StatisticalError(String analysisType, String reason) implements AnalysisFailure {
        public StatisticalError {
            Fields.required(analysisType, "analysisType");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Statistical error in " + analysisType + " analysis: " + reason;
        }
    }

    /** Carries both the observed age and the configured maximum. */
    record StaleData(String analysisType, Duration age, Duration maxAge) implements AnalysisFailure {
        public StaleData {
            Fields.required(analysisType, "analysisType");
            Fields.nonNegative(age, "age");
            Fields.nonNegative(maxAge, "maxAge");
        }

        @Override
        public String message() {
            return analysisType + " data is stale: age " + FailureText.formatDuration(age)
                    + " exceeds maximum " + FailureText.formatDuration(maxAge);
        }
    }
}
