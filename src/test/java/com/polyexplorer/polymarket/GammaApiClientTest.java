package com.polyexplorer.polymarket;

import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.SourceFailure;
import com.polyexplorer.core.error.Stage;
import com.polyexplorer.core.error.TransportFailure;
import com.polyexplorer.data.http.HttpClientEx;
import com.polyexplorer.data.http.HttpTextResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GammaApiClientTest {

    private GammaStubServer gamma;
    private GammaApiClient client;

    @BeforeEach
    void setUp() throws IOException {
        gamma = new GammaStubServer();
        HttpClientEx http = new HttpClientEx(Config.fromProperties(Path.of("."), Map.of("display.body_max_len", 50)));
        client = new GammaApiClient(http, gamma.baseUrl() + "/", 5);
    }

    @AfterEach
    void tearDown() {
        gamma.close();
    }

    @Test
    void fetchEventJsonShouldReturnBody() {
        gamma.event("fed", "{\"slug\":\"fed\"}");

        assertEquals("{\"slug\":\"fed\"}", client.fetchEventJson("fed"));
    }

    @Test
    void missingEventShouldBeMarketGroupNotFound() {
        PipelineException e = assertThrows(PipelineException.class, () -> client.fetchEventJson("non-existent-market"));

        assertEquals(Stage.DATA_SOURCE, e.stage());
        assertEquals(new SourceFailure.MarketGroupNotFound("non-existent-market"), e.failure().failure());
    }

    @Test
    void rateLimitShouldCarryRetryAfter() {
        gamma.reply("/events/slug/fed", 429, "slow down", Map.of("Retry-After", "60"));

        PipelineException e = assertThrows(PipelineException.class, () -> client.fetchEventJson("fed"));

        SourceFailure.RateLimitExceeded failure =
                assertInstanceOf(SourceFailure.RateLimitExceeded.class, e.failure().failure());
        assertEquals(Duration.ofSeconds(60), failure.retryHint().orElseThrow());
    }

    @Test
    void credentialAndOutageStatusesShouldBeSourceFailures() {
        gamma.reply("/events/slug/secret", 403, "forbidden");
        gamma.reply("/events/slug/down", 503, "maintenance");

        PipelineException auth = assertThrows(PipelineException.class, () -> client.fetchEventJson("secret"));
        PipelineException down = assertThrows(PipelineException.class, () -> client.fetchEventJson("down"));

        assertInstanceOf(SourceFailure.AuthenticationFailed.class, auth.failure().failure());
        assertInstanceOf(SourceFailure.ApiUnavailable.class, down.failure().failure());
    }

    @Test
    void otherErrorStatusesShouldStayTransportFailures() {
        gamma.reply("/events/slug/fed", 500, "e".repeat(80));

        PipelineException e = assertThrows(PipelineException.class, () -> client.fetchEventJson("fed"));

        TransportFailure.RequestFailed failure =
                assertInstanceOf(TransportFailure.RequestFailed.class, e.failure().failure());
        assertEquals(500, failure.status());
        assertEquals(gamma.baseUrl() + "/events/slug/fed", failure.url());
        assertEquals("e".repeat(50) + "... (truncated)", failure.body());
    }

    @Test
    void emptyBodyShouldBeInvalidApiResponse() {
        gamma.reply("/events/slug/fed", 200, "null");

        PipelineException e = assertThrows(PipelineException.class, () -> client.fetchEventJson("fed"));

        SourceFailure.InvalidApiResponse failure =
                assertInstanceOf(SourceFailure.InvalidApiResponse.class, e.failure().failure());
        assertTrue(failure.reason().contains("fed"));
    }

    @Test
    void eventUrlShouldEncodeSlug() {
        assertEquals(gamma.baseUrl() + "/events/slug/fed%20cut%3F", client.eventUrl("fed cut?"));
    }

    @Test
    void retryAfterShouldIgnoreHttpDates() {
        HttpTextResponse dated = new HttpTextResponse("u", 429, "",
                Map.of("Retry-After", List.of("Wed, 21 Oct 2015 07:28:00 GMT")));
        HttpTextResponse absent = new HttpTextResponse("u", 429, "", Map.of());

        assertNull(GammaApiClient.retryAfter(dated));
        assertNull(GammaApiClient.retryAfter(absent));
    }
}
