package com.polyexplorer.core.error;

import java.time.Duration;
import java.util.Optional;

/**
 * Failures interpreting a remote API's domain-level answer. The "not found" variants describe
 * absence and therefore never carry a response body.
 */
public sealed interface SourceFailure extends StageFailure {

    @Override
    default Stage stage() {
        return Stage.DATA_SOURCE;
    }

    @Override
    default PipelineFailure promote() {
        return new PipelineFailure.DataSource(this);
    }

    record MarketGroupNotFound(String slug) implements SourceFailure {
        public MarketGroupNotFound {
            Fields.required(slug, "slug");
        }

        @Override
        public String message() {
            return "Market group '" + slug + "' not found";
        }
    }

    record MarketNotFound(String groupSlug, String marketSlug) implements SourceFailure {
        public MarketNotFound {
            Fields.required(groupSlug, "groupSlug");
            Fields.required(marketSlug, "marketSlug");
        }

        @Override
        public String message() {
            return "Market '" + marketSlug + "' not found in group '" + groupSlug + "'";
        }
    }

    record InvalidApiResponse(String reason, String rawSnippet) implements SourceFailure {
        public InvalidApiResponse {
            Fields.required(reason, "reason");
            rawSnippet = FailureText.jsonErrorSnippet(Fields.required(rawSnippet, "rawSnippet"),
                    FailureText.MAX_SNIPPET_LENGTH);
        }

        @Override
        public String message() {
            return "API returned invalid response: " + reason + "\nResponse: " + rawSnippet;
        }
    }

    /**
     * {@code retryAfter} is null when the API gave no retry hint.
     */
    record RateLimitExceeded(Duration retryAfter) implements SourceFailure {
        public RateLimitExceeded {
            if (retryAfter != null) {
                Fields.nonNegative(retryAfter, "retryAfter");
            }
        }

        public Optional<Duration> retryHint() {
            return Optional.ofNullable(retryAfter);
        }

        @Override
        public String message() {
            if (retryAfter == null) {
                return "API rate limit exceeded";
            }
            return "API rate limit exceeded. Retry after " + retryAfter.toSeconds() + " seconds";
        }
    }

    record AuthenticationFailed(String reason) implements SourceFailure {
        public AuthenticationFailed {
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "API authentication failed: " + reason;
        }
    }

    record ApiUnavailable(String reason) implements SourceFailure {
        public ApiUnavailable {
            Fields.required(reason, "reason");
        }

        @Override
        public String message() {
            return "API is unavailable: " + reason;
        }
    }
}
