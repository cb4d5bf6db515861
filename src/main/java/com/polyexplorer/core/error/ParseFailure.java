package com.polyexplorer.core.error;

import java.util.Optional;

/**
 * Failures translating raw text into typed structures. Raw fragments are bounded on construction.
 */
public sealed interface ParseFailure extends StageFailure {

    @Override
    default Stage stage() {
        return Stage.PARSE;
    }

    @Override
    default PipelineFailure promote() {
        return new PipelineFailure.Parse(this);
    }

    /**
     * {@code fieldName} is null only when the whole payload failed to deserialize.
     */
    record JsonDeserializationFailed(String fieldName, String expectedType, String jsonSnippet, String reason)
            implements ParseFailure {
        public JsonDeserializationFailed {
            Fields.required(expectedType, "expectedType");
            jsonSnippet = FailureText.jsonErrorSnippet(Fields.required(jsonSnippet, "jsonSnippet"),
                    FailureText.MAX_SNIPPET_LENGTH);
            reason = FailureText.clip(Fields.required(reason, "reason"), FailureText.MAX_SNIPPET_LENGTH);
        }

        public Optional<String> field() {
            return Optional.ofNullable(fieldName);
        }

        @Override
        public String message() {
            String target = fieldName == null ? "" : " for field '" + fieldName + "'";
            return "Failed to deserialize JSON" + target + ": Expected type '" + expectedType + "'"
                    + "\nReason: " + reason
                    + "\nJSON: " + jsonSnippet;
        }
    }

    record MissingField(String fieldName) implements ParseFailure {
        public MissingField {
            Fields.required(fieldName, "fieldName");
        }

        @Override
        public String message() {
            return "Required field '" + fieldName + "' is missing";
        }
    }

    record InvalidFieldFormat(String fieldName, String expectedFormat, String actual) implements ParseFailure {
        public InvalidFieldFormat {
            Fields.required(fieldName, "fieldName");
            Fields.required(expectedFormat, "expectedFormat");
            actual = FailureText.clip(Fields.required(actual, "actual"), FailureText.MAX_SNIPPET_LENGTH);
        }

        @Override
        public String message() {
            return "Field '" + fieldName + "' has invalid format. Expected: " + expectedFormat + ", Got: " + actual;
        }
    }

    record InvalidArrayLength(String fieldName, int expected, int actual) implements ParseFailure {
        public InvalidArrayLength {
            Fields.required(fieldName, "fieldName");
            Fields.nonNegative(expected, "expected");
            Fields.nonNegative(actual, "actual");
        }

        @Override
        public String message() {
            return "Array '" + fieldName + "' has invalid length. Expected: " + expected + ", Got: " + actual;
        }
    }

    record InvalidNumber(String fieldName, String rawValue, String reason) implements ParseFailure {
        public InvalidNumber {
            Fields.required(fieldName, "fieldName");
            rawValue = FailureText.clip(Fields.required(rawValue, "rawValue"), FailureText.MAX_SNIPPET_LENGTH);
            reason = FailureText.clip(Fields.required(reason, "reason"), FailureText.MAX_SNIPPET_LENGTH);
        }

        @Override
        public String message() {
            return "Field '" + fieldName + "' has invalid number '" + rawValue + "': " + reason;
        }
    }
}
