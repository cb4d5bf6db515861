package com.polyexplorer.app;

import com.polyexplorer.core.error.FailureText;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.PipelineFailure;
import com.polyexplorer.core.error.Stage;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.PrintStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Terminal presentation of a pipeline failure: one message, one tip chosen by stage, and the
 * process exit code. Tips depend on the stage tag only, never on the nested variant.
 */
public final class FailureReporter {
    private static final Logger LOG = LogManager.getLogger(FailureReporter.class);

    public static final int FAILURE_EXIT_CODE = 1;

    private static final int MAX_CAUSES = 16;
    private static final Map<Stage, String> TIPS = buildTips();

    /** What gets shown to the user for one terminal failure. */
    public record FailureReport(String message, String tip, int exitCode) {
        public FailureReport {
            Objects.requireNonNull(message, "message must not be null");
            Objects.requireNonNull(tip, "tip must not be null");
        }
    }

    public static String tip(Stage stage) {
        return TIPS.get(Objects.requireNonNull(stage, "stage must not be null"));
    }

    public FailureReport report(PipelineFailure failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        return new FailureReport(failure.message(), tip(failure.stage()), FAILURE_EXIT_CODE);
    }

    /**
     * Prints the failure to {@code err} and returns the exit code. A broken stream is logged and
     * otherwise ignored; presenting a failure never fails itself.
     */
    public int present(PipelineException error, PrintStream err) {
        FailureReport report = report(error.failure());
        StringBuilder sb = new StringBuilder(256);
        sb.append("Error: ").append(report.message()).append("\n");
        Throwable cause = error.getCause();
        if (cause != null) {
            sb.append("\nCaused by:\n");
            for (int i = 0; cause != null && i < MAX_CAUSES; i++, cause = cause.getCause()) {
                sb.append("  ").append(i).append(": ").append(describe(cause)).append("\n");
            }
        }
        sb.append("\nTip: ").append(report.tip()).append("\n");

        err.print(sb);
        err.flush();
        if (err.checkError()) {
            LOG.error("could not write failure report, stage={} message={}", error.stage(), report.message());
        }
        return report.exitCode();
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            return cause.getClass().getName();
        }
        return FailureText.truncateForDisplay(message, FailureText.MAX_SNIPPET_LENGTH);
    }

    private static Map<Stage, String> buildTips() {
        Map<Stage, String> tips = new EnumMap<>(Stage.class);
        tips.put(Stage.HTTP, "check connectivity and URL correctness");
        tips.put(Stage.DATA_SOURCE, "verify the identifier exists at the remote source");
        tips.put(Stage.PARSE, "the remote response shape may have changed");
        tips.put(Stage.NORMALIZATION, "source data failed a consistency check");
        tips.put(Stage.ANALYSIS, "insufficient or stale data for the requested analysis");
        tips.put(Stage.OUTPUT, "local output/formatting environment issue");
        return Collections.unmodifiableMap(tips);
    }
}
