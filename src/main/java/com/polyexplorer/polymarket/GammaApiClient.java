package com.polyexplorer.polymarket;

import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.SourceFailure;
import com.polyexplorer.data.http.HttpClientEx;
import com.polyexplorer.data.http.HttpTextResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Gamma API source. Interprets HTTP statuses that carry domain meaning (missing event, rate limit,
 * credentials, outage) and leaves any other non-success to the transport.
 */
public final class GammaApiClient {
    private static final Logger LOG = LogManager.getLogger(GammaApiClient.class);

    private final HttpClientEx http;
    private final String baseUrl;
    private final int timeoutSec;

    public GammaApiClient(Config config, HttpClientEx http) {
        this(http, config.getString("polymarket.gamma_base_url"), config.getInt("http.timeout_sec"));
    }

    GammaApiClient(HttpClientEx http, String baseUrl, int timeoutSec) {
        this.http = http;
        String base = baseUrl == null ? "" : baseUrl.trim();
        this.baseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        this.timeoutSec = Math.max(1, timeoutSec);
    }

    /**
     * Fetches the raw event JSON for a market group slug.
     */
    public String fetchEventJson(String slug) {
        String url = eventUrl(slug);
        HttpTextResponse resp = http.fetch(url, timeoutSec);
        int status = resp.status();
        if (status == 404) {
            throw new PipelineException(new SourceFailure.MarketGroupNotFound(slug));
        }
        if (status == 429) {
            throw new PipelineException(new SourceFailure.RateLimitExceeded(retryAfter(resp)));
        }
        if (status == 401 || status == 403) {
            throw new PipelineException(new SourceFailure.AuthenticationFailed(
                    "HTTP " + status + " from " + url));
        }
        if (status == 502 || status == 503 || status == 504) {
            throw new PipelineException(new SourceFailure.ApiUnavailable(
                    "Gamma API answered HTTP " + status + " for " + url));
        }
        http.requireSuccess(resp);

        String body = resp.body().trim();
        if (body.isEmpty() || body.equals("null")) {
            throw new PipelineException(new SourceFailure.InvalidApiResponse(
                    "empty response body for event '" + slug + "'", resp.body()));
        }
        LOG.debug("fetched event {} ({} chars)", slug, body.length());
        return body;
    }

    String eventUrl(String slug) {
        String encoded = URLEncoder.encode(slug == null ? "" : slug, StandardCharsets.UTF_8).replace("+", "%20");
        return baseUrl + "/events/slug/" + encoded;
    }

    static Duration retryAfter(HttpTextResponse resp) {
        String raw = resp.header("Retry-After").orElse("").trim();
        if (raw.isEmpty()) {
            return null;
        }
        try {
            long seconds = Long.parseLong(raw);
            return seconds < 0 ? null : Duration.ofSeconds(seconds);
        } catch (NumberFormatException ignored) {
            // HTTP-date form is not interpreted
            return null;
        }
    }
}
