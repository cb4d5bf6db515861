package com.polyexplorer.core.error;

import java.util.List;

/**
 * Failures standardizing source data into the canonical market schema. Always scoped to one
 * market.
 */
public sealed interface NormalizationFailure extends StageFailure {

    String marketSlug();

    @Override
    default Stage stage() {
        return Stage.NORMALIZATION;
    }

    @Override
    default PipelineFailure promote() {
        return new PipelineFailure.Normalization(this);
    }

    record TokenIdExtractionFailed(String marketSlug, String reason) implements NormalizationFailure {
        public TokenIdExtractionFailed {
            Fields.required(marketSlug, "marketSlug");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Failed to extract token IDs for market '" + marketSlug + "': " + reason;
        }
    }

    record OutcomeMappingFailed(String marketSlug, List<String> outcomes, String reason)
            implements NormalizationFailure {
        public OutcomeMappingFailed {
            Fields.required(marketSlug, "marketSlug");
            outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
            Fields.required(reason, "reason");
        }

        public OutcomeMappingFailed(String marketSlug, String reason) {
            this(marketSlug, List.of(), reason);
        }

        @Override
        public String message() {
            return "Failed to map outcomes for market '" + marketSlug + "' (outcomes: " + outcomes + "): " + reason;
        }
    }

    record InvalidPriceData(String marketSlug, String fieldName, String reason) implements NormalizationFailure {
        public InvalidPriceData {
            Fields.required(marketSlug, "marketSlug");
            Fields.required(fieldName, "fieldName");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid price data in market '" + marketSlug + "' for field '" + fieldName + "': " + reason;
        }
    }

    record InvalidVolumeData(String marketSlug, String fieldName, String reason) implements NormalizationFailure {
        public InvalidVolumeData {
            Fields.required(marketSlug, "marketSlug");
            Fields.required(fieldName, "fieldName");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid volume data in market '" + marketSlug + "' for field '" + fieldName + "': " + reason;
        }
    }

    record ValidationFailed(String marketSlug, String reason) implements NormalizationFailure {
        public ValidationFailed {
            Fields.required(marketSlug, "marketSlug");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Validation failed for market '" + marketSlug + "': " + reason;
        }
    }

    record EmptyRequiredField(String marketSlug, String fieldName) implements NormalizationFailure {
        public EmptyRequiredField {
            Fields.required(marketSlug, "marketSlug");
            Fields.required(fieldName, "fieldName");
        }

        @Override
        public String message() {
            return "Required field '" + fieldName + "' is empty in market '" + marketSlug + "'";
        }
    }
}
