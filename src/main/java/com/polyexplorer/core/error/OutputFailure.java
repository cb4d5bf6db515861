package com.polyexplorer.core.error;

/**
 * Failures of the final formatting and writing step. Terminal stage: variants hold only text,
 * so an output failure can never wrap another one.
 */
public sealed interface OutputFailure extends StageFailure {

    @Override
    default Stage stage() {
        return Stage.OUTPUT;
    }

    @Override
    default PipelineFailure promote() {
        return new PipelineFailure.Output(this);
    }

    record FormattingFailed(String dataType, String reason) implements OutputFailure {
        public FormattingFailed {
            Fields.required(dataType, "dataType");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Failed to format " + dataType + " for output: " + reason;
        }
    }

    record WriteFailed(String target, String reason) implements OutputFailure {
        public WriteFailed {
            Fields.required(target, "target");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Failed to write output to " + target + ": " + reason;
        }
    }
}
