package com.polyexplorer.data.http;

import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.FailureText;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.TransportFailure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Transport collaborator. Every low-level problem leaves this class as a {@link PipelineException}
 * holding a {@link TransportFailure} with the exact URL that was attempted.
 */
public class HttpClientEx {
    private static final Logger LOG = LogManager.getLogger(HttpClientEx.class);
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(20);

    private final HttpClient client;
    private final String userAgent;
    private final int bodyMaxLen;

    public HttpClientEx(Config config) {
        this(
                HttpClient.newBuilder()
                        .connectTimeout(CONNECT_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                config.getString("http.user_agent"),
                config.getInt("display.body_max_len")
        );
    }

    HttpClientEx(HttpClient client, String userAgent, int bodyMaxLen) {
        this.client = client;
        this.userAgent = userAgent == null || userAgent.isBlank() ? "PolyExplorer/0.1" : userAgent;
        this.bodyMaxLen = Math.max(0, Math.min(bodyMaxLen, FailureText.MAX_SNIPPET_LENGTH));
    }

    /**
     * Performs a GET and returns the response for any status. Callers that interpret statuses
     * themselves use this; the rest use {@link #getText(String, int)}.
     */
    public HttpTextResponse fetch(String url, int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(Math.max(1, timeoutSeconds));
        HttpRequest req = buildGet(url, timeout);
        LOG.info("sent GET request to URL: {}", url);
        try {
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            LOG.debug("GET {} -> {} ({} chars)", url, resp.statusCode(), resp.body() == null ? 0 : resp.body().length());
            return new HttpTextResponse(url, resp.statusCode(), resp.body(), resp.headers().map());
        } catch (HttpConnectTimeoutException e) {
            // fired by the client's connect limit, not the request timeout
            Duration connectTimeout = client.connectTimeout().orElse(timeout);
            throw new PipelineException(new TransportFailure.Timeout(url, connectTimeout), e);
        } catch (HttpTimeoutException e) {
            throw new PipelineException(new TransportFailure.Timeout(url, timeout), e);
        } catch (ConnectException e) {
            throw new PipelineException(new TransportFailure.ConnectionFailed(url, reasonOf(e)), e);
        } catch (IOException e) {
            throw new PipelineException(new TransportFailure.ResponseReadError(url, reasonOf(e)), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException(new TransportFailure.ConnectionFailed(url, "request interrupted"), e);
        }
    }

    /**
     * GET that requires a 2xx answer and returns its body.
     */
    public String getText(String url, int timeoutSeconds) {
        return requireSuccess(fetch(url, timeoutSeconds)).body();
    }

    /**
     * Raises {@link TransportFailure.RequestFailed} for non-2xx responses, with the body bounded
     * for display.
     */
    public HttpTextResponse requireSuccess(HttpTextResponse resp) {
        if (resp.isSuccess()) {
            return resp;
        }
        if (resp.status() < 100 || resp.status() > 599) {
            throw new PipelineException(new TransportFailure.ResponseReadError(
                    resp.url(), "invalid HTTP status " + resp.status()));
        }
        throw new PipelineException(new TransportFailure.RequestFailed(
                resp.status(),
                resp.url(),
                FailureText.truncateForDisplay(resp.body(), bodyMaxLen)
        ));
    }

    /**
     * Reads a local UTF-8 text file; failures are reported against the file's URI.
     */
    public String readLocalFile(Path path) {
        String url = path.toAbsolutePath().toUri().toString();
        LOG.debug("reading local file {}", url);
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new PipelineException(new TransportFailure.ResponseReadError(url, "file not found"), e);
        } catch (IOException e) {
            throw new PipelineException(new TransportFailure.ResponseReadError(url, reasonOf(e)), e);
        }
    }

    private HttpRequest buildGet(String url, Duration timeout) {
        if (url == null || url.isBlank()) {
            throw new PipelineException(new TransportFailure.InvalidUrl(url == null ? "" : url, "URL is empty"));
        }
        try {
            return HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .GET()
                    .header("User-Agent", userAgent)
                    .header("Accept", "application/json")
                    .build();
        } catch (IllegalArgumentException e) {
            throw new PipelineException(new TransportFailure.InvalidUrl(url, reasonOf(e)), e);
        }
    }

    private static String reasonOf(Exception e) {
        String message = e.getMessage();
        if (message == null || message.isBlank()) {
            Throwable cause = e.getCause();
            if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
                return cause.getMessage();
            }
            return e.getClass().getSimpleName();
        }
        return message;
    }
}
