package com.polyexplorer.output;

import com.polyexplorer.core.error.OutputFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.Stage;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.MarketGroup;
import com.polyexplorer.model.MarketSummary;
import com.polyexplorer.model.PositionExposure;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketReportPrinterTest {

    private static Market market() {
        return Market.builder()
                .slug("will-it-rain")
                .question("Will it rain?")
                .conditionId("0xcond")
                .yesTokenId("101")
                .noTokenId("102")
                .yesPrice(0.62)
                .noPrice(0.40)
                .active(true)
                .volume(1234567.891)
                .liquidity(400)
                .lastTradePrice(0.61)
                .updatedAt(Instant.parse("2024-12-10T11:30:00Z"))
                .build();
    }

    private static MarketSummary summary(double probability) {
        return MarketSummary.builder()
                .marketSlug("will-it-rain")
                .impliedProbability(probability)
                .overround(0.02)
                .volumeToLiquidity(2.5)
                .build();
    }

    @Test
    void printMarketShouldRenderSections() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        MarketReportPrinter printer = new MarketReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        PositionExposure exposure = PositionExposure.builder()
                .marketSlug("will-it-rain").holders(2).positions(3)
                .yesShares(150).noShares(50).yesShareRatio(0.75)
                .costBasis(100).markValue(113).unrealizedPnl(13)
                .build();

        printer.printMarket(market(), summary(0.6078), exposure);

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.startsWith(MarketReportPrinter.RULE + "\nWill it rain?\n" + MarketReportPrinter.RULE + "\n"));
        assertEquals(67, MarketReportPrinter.RULE.length());
        assertTrue(text.contains("YES token:    101"));
        assertTrue(text.contains("Status:       active"));
        assertTrue(text.contains("Updated:      2024-12-10 11:30 UTC"));
        assertTrue(text.contains("Ends:         n/a"));
        assertTrue(text.contains("total $1,234,567.89"));
        assertTrue(text.contains("Book:         bid n/a | ask n/a"));
        assertTrue(text.contains("Implied YES probability: 60.78%"));
        assertTrue(text.contains("Spread:                  n/a"));
        assertTrue(text.contains("Holders / positions:     2 / 3"));
        assertTrue(text.contains("Unrealized PnL:          $13.00"));
    }

    @Test
    void printGroupShouldRenderHeader() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        MarketReportPrinter printer = new MarketReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        printer.printGroup(MarketGroup.builder().slug("fed").title("Fed decision?").closed(true).market(market()).build());

        String text = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(text.contains("Slug:       fed"));
        assertTrue(text.contains("Status:     closed"));
        assertTrue(text.contains("Markets:    1"));
    }

    @Test
    void nonFiniteNumberShouldFailFormattingWithoutWriting() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        MarketReportPrinter printer = new MarketReportPrinter(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        PipelineException e = assertThrows(PipelineException.class,
                () -> printer.printMarket(market(), summary(Double.NaN), null));

        assertEquals(Stage.OUTPUT, e.stage());
        OutputFailure.FormattingFailed failure = assertInstanceOf(OutputFailure.FormattingFailed.class, e.failure().failure());
        assertEquals("market summary", failure.dataType());
        assertTrue(failure.reason().contains("impliedProbability"));
        assertEquals(0, buffer.size());
    }

    @Test
    void brokenStreamShouldFailWrite() {
        PrintStream broken = new PrintStream(new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("broken pipe");
            }
        });
        MarketReportPrinter printer = new MarketReportPrinter(broken);

        PipelineException e = assertThrows(PipelineException.class, () -> printer.printMarket(market(), null, null));

        OutputFailure.WriteFailed failure = assertInstanceOf(OutputFailure.WriteFailed.class, e.failure().failure());
        assertEquals("stdout", failure.target());
        assertFalse(failure.message().isEmpty());
    }
}
