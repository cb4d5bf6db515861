package com.polyexplorer.core.error;

/**
 * Pipeline stage that produced a failure. The tag of a {@link PipelineFailure} uniquely
 * determines which {@link StageFailure} type it holds.
 */
public enum Stage {
    HTTP("HTTP Error"),
    DATA_SOURCE("Data Source Error"),
    PARSE("Parse Error"),
    NORMALIZATION("Normalization Error"),
    ANALYSIS("Analysis Error"),
    OUTPUT("Output Error");

    private final String label;

    Stage(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
