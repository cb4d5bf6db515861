package com.polyexplorer.core.error;

import java.time.Duration;

/**
 * Failures of the network transport. Every variant carries the exact URL that was attempted.
 */
public sealed interface TransportFailure extends StageFailure {

    String url();

    @Override
    default Stage stage() {
        return Stage.HTTP;
    }

    @Override
    default PipelineFailure promote() {
        return new PipelineFailure.Http(this);
    }

    /** The server answered with a non-success status. */
    record RequestFailed(int status, String url, String body) implements TransportFailure {
        public RequestFailed {
            if (status < 100 || status > 599) {
                throw new IllegalArgumentException("not an HTTP status code: " + status);
            }
            Fields.required(url, "url");
            body = FailureText.clip(Fields.required(body, "body"), FailureText.MAX_BODY_LENGTH);
        }

        @Override
        public String message() {
            return "HTTP request failed with status " + status + ": " + url + "\nResponse: " + body;
        }
    }

    record ConnectionFailed(String url, String reason) implements TransportFailure {
        public ConnectionFailed {
            Fields.required(url, "url");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Failed to connect to " + url + ": " + reason;
        }
    }

    record Timeout(String url, Duration duration) implements TransportFailure {
        public Timeout {
            Fields.required(url, "url");
            Fields.nonNegative(duration, "duration");
        }

        @Override
        public String message() {
            return "Request to " + url + " timed out after " + duration.toSeconds() + " seconds";
        }
    }

    record InvalidUrl(String url, String reason) implements TransportFailure {
        public InvalidUrl {
            Fields.required(url, "url");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Invalid URL '" + url + "': " + reason;
        }
    }

    record ResponseReadError(String url, String reason) implements TransportFailure {
        public ResponseReadError {
            Fields.required(url, "url");
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "Failed to read response from " + url + ": " + reason;
        }
    }
}
