package com.polyexplorer.app;

import com.polyexplorer.polymarket.GammaStubServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PolyExplorerApplicationTest {

    private static final String GROUP = "fed-decision-in-december";
    private static final String CUT_25 = "fed-decreases-interest-rates-by-25-bps-after-december-2024-meeting";
    private static final String YES_TOKEN = "71321045679252212594626385532706912750332728571942532289631379312455583992563";
    private static final String NO_TOKEN = "52114319501245915516055106046884209969926127482827954674443846427813813222426";
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-12-10T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path workingDir;

    private GammaStubServer gamma;
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    @BeforeEach
    void setUp() throws IOException {
        gamma = new GammaStubServer();
        gamma.event(GROUP, fixture());
        Files.writeString(workingDir.resolve("config.properties"),
                "polymarket.gamma_base_url=" + gamma.baseUrl() + "\nhttp.timeout_sec=5\n", StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        gamma.close();
    }

    @Test
    void helpShouldPrintUsageAndSucceed() {
        int exit = run("--help");

        assertEquals(0, exit);
        assertTrue(stdout().contains("--market-slug"), stdout());
    }

    @Test
    void missingSlugShouldBeUsageError() {
        int exit = run("--market", "x");

        assertEquals(2, exit);
        assertTrue(stderr().contains("ERROR:"), stderr());
    }

    @Test
    void reportShouldCoverActiveMarketsOnly() {
        int exit = run("-s", GROUP);

        assertEquals(0, exit, stderr());
        assertTrue(stdout().contains("Fed decision in December?"));
        assertTrue(stdout().contains("Fed decreases interest rates by 25 bps after December 2024 meeting?"));
        assertFalse(stdout().contains("No change in Fed interest rates"));
        assertTrue(stdout().contains("Implied YES probability:"));
    }

    @Test
    void unknownGroupShouldPresentFailureWithTip() {
        int exit = run("--market-slug", "non-existent-market");

        assertEquals(1, exit);
        assertTrue(stderr().contains("Error: Data Source Error: Market group 'non-existent-market' not found"), stderr());
        assertTrue(stderr().contains("Tip: verify the identifier exists at the remote source"), stderr());
        assertEquals("", stdout());
    }

    @Test
    void unknownMarketShouldFailWithSourceTip() {
        int exit = run("-s", GROUP, "-m", "no-such-market");

        assertEquals(1, exit);
        assertTrue(stderr().contains("Market 'no-such-market' not found in group '" + GROUP + "'"), stderr());
    }

    @Test
    void positionsShouldAddExposureSection() throws IOException {
        Files.writeString(workingDir.resolve("positions.csv"),
                "trader_address,token_id,market_id,side,shares_held,avg_entry_price\n"
                        + "0xaaa," + YES_TOKEN + ",0x2a8f1e9b6c31d4ab,YES,100,0.5\n"
                        + "0xbbb," + NO_TOKEN + ",0x2a8f1e9b6c31d4ab,NO,40,0.45\n",
                StandardCharsets.UTF_8);

        int exit = run("-s", GROUP, "-m", CUT_25, "-p", "positions.csv");

        assertEquals(0, exit, stderr());
        assertTrue(stdout().contains("Holders / positions:     2 / 2"), stdout());
    }

    @Test
    void missingPositionsFileShouldBeHttpStageFailure() {
        int exit = run("-s", GROUP, "-p", "absent.csv");

        assertEquals(1, exit);
        assertTrue(stderr().contains("Error: HTTP Error: Failed to read response from"), stderr());
        assertTrue(stderr().contains("Caused by:"), stderr());
        assertTrue(stderr().contains("Tip: check connectivity and URL correctness"), stderr());
    }

    @Test
    void staleDataShouldFailAnalysis() {
        Clock later = Clock.fixed(Instant.parse("2024-12-20T12:00:00Z"), ZoneOffset.UTC);

        int exit = new PolyExplorerApplication(print(out), print(err), workingDir, later).run(new String[]{"-s", GROUP});

        assertEquals(1, exit);
        assertTrue(stderr().contains("Analysis Error: market data is stale"), stderr());
        assertTrue(stderr().contains("Tip: insufficient or stale data for the requested analysis"), stderr());
    }

    private int run(String... args) {
        return new PolyExplorerApplication(print(out), print(err), workingDir, CLOCK).run(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static PrintStream print(ByteArrayOutputStream buffer) {
        return new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private static String fixture() throws IOException {
        try (InputStream in = PolyExplorerApplicationTest.class.getClassLoader()
                .getResourceAsStream("fixtures/gamma-event.json")) {
            if (in == null) {
                throw new IOException("fixtures/gamma-event.json is not on the test classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
