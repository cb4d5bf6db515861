package com.polyexplorer.output;

import com.polyexplorer.core.error.OutputFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.MarketGroup;
import com.polyexplorer.model.MarketSummary;
import com.polyexplorer.model.PositionExposure;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Plain-text console report. Each section is rendered completely before it is written, so a
 * formatting failure never leaves half a section on the stream.
 */
public final class MarketReportPrinter {

    static final String RULE = "=".repeat(67);
    static final String NOT_AVAILABLE = "n/a";

    private static final DateTimeFormatter DISPLAY_TS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'").withZone(ZoneOffset.UTC);

    private final PrintStream out;
    private final String target;

    public MarketReportPrinter(PrintStream out) {
        this(out, "stdout");
    }

    public MarketReportPrinter(PrintStream out, String target) {
        this.out = out;
        this.target = target;
    }

    /**
     * Writes the group header.
     *
     * @throws com.polyexplorer.core.error.PipelineException with {@code WriteFailed} when the
     *                                                       stream reports an error
     */
    public void printGroup(MarketGroup group) {
        write(renderGroup(group));
    }

    /**
     * Writes one market section. {@code summary} and {@code exposure} are optional; their
     * sections are left out when null.
     *
     * @throws com.polyexplorer.core.error.PipelineException with {@code FormattingFailed} for a
     *                                                       non-finite number, nothing written,
     *                                                       or {@code WriteFailed}
     */
    public void printMarket(Market market, MarketSummary summary, PositionExposure exposure) {
        write(renderMarket(market, summary, exposure));
    }

    String renderGroup(MarketGroup group) {
        String type = "market group";
        StringBuilder sb = new StringBuilder(512);
        header(sb, group.getTitle());
        sb.append("Slug:       ").append(group.getSlug()).append("\n");
        sb.append("Status:     ").append(status(group.isActive(), group.isClosed())).append("\n");
        sb.append("Volume:     ").append(money(type, "volume", group.getVolume())).append("\n");
        sb.append("Liquidity:  ").append(money(type, "liquidity", group.getLiquidity())).append("\n");
        sb.append("Markets:    ").append(group.getMarkets().size()).append("\n");
        return sb.toString();
    }

    String renderMarket(Market market, MarketSummary summary, PositionExposure exposure) {
        StringBuilder sb = new StringBuilder(2048);
        String type = "market";
        header(sb, market.getQuestion());
        sb.append("Slug:         ").append(market.getSlug()).append("\n");
        sb.append("Condition:    ").append(market.getConditionId()).append("\n");
        sb.append("YES token:    ").append(market.getYesTokenId()).append("\n");
        sb.append("NO token:     ").append(market.getNoTokenId()).append("\n");
        sb.append("Status:       ").append(status(market.isActive(), market.isClosed())).append("\n");
        sb.append("Updated:      ").append(timestamp(market.getUpdatedAt())).append("\n");
        sb.append("Ends:         ").append(timestamp(market.getEndDate())).append("\n");
        sb.append("Prices:       YES ").append(price(type, "yesPrice", market.getYesPrice()))
                .append(" | NO ").append(price(type, "noPrice", market.getNoPrice()))
                .append(" | last ").append(price(type, "lastTradePrice", market.getLastTradePrice())).append("\n");
        sb.append("Book:         bid ").append(price(type, "bestBid", market.getBestBid()))
                .append(" | ask ").append(price(type, "bestAsk", market.getBestAsk())).append("\n");
        sb.append("Volume:       total ").append(money(type, "volume", market.getVolume()))
                .append(" | 24h ").append(money(type, "volume24h", market.getVolume24h()))
                .append(" | 1w ").append(money(type, "volume1w", market.getVolume1w()))
                .append(" | 1m ").append(money(type, "volume1m", market.getVolume1m()))
                .append(" | 1y ").append(money(type, "volume1y", market.getVolume1y())).append("\n");
        sb.append("Liquidity:    ").append(money(type, "liquidity", market.getLiquidity())).append("\n");

        if (summary != null) {
            String st = "market summary";
            sb.append("\nSummary\n");
            sb.append("  Implied YES probability: ").append(percent(st, "impliedProbability", summary.getImpliedProbability())).append("\n");
            sb.append("  Overround:               ").append(price(st, "overround", summary.getOverround())).append("\n");
            sb.append("  Spread:                  ").append(price(st, "spread", summary.getSpread())).append("\n");
            sb.append("  Mid price:               ").append(price(st, "midPrice", summary.getMidPrice())).append("\n");
            sb.append("  24h share of week:       ").append(percent(st, "volume24hShareOfWeek", summary.getVolume24hShareOfWeek())).append("\n");
            sb.append("  Volume / liquidity:      ").append(ratio(st, "volumeToLiquidity", summary.getVolumeToLiquidity())).append("\n");
        }

        if (exposure != null) {
            String et = "position exposure";
            sb.append("\nPositions\n");
            sb.append("  Holders / positions:     ").append(exposure.getHolders())
                    .append(" / ").append(exposure.getPositions()).append("\n");
            sb.append("  YES shares:              ").append(ratio(et, "yesShares", exposure.getYesShares())).append("\n");
            sb.append("  NO shares:               ").append(ratio(et, "noShares", exposure.getNoShares())).append("\n");
            sb.append("  YES share ratio:         ").append(percent(et, "yesShareRatio", exposure.getYesShareRatio())).append("\n");
            sb.append("  Cost basis:              ").append(money(et, "costBasis", exposure.getCostBasis())).append("\n");
            sb.append("  Mark value:              ").append(money(et, "markValue", exposure.getMarkValue())).append("\n");
            sb.append("  Unrealized PnL:          ").append(money(et, "unrealizedPnl", exposure.getUnrealizedPnl())).append("\n");
        }
        return sb.toString();
    }

    private void write(String section) {
        out.print(section);
        out.flush();
        if (out.checkError()) {
            throw new PipelineException(new OutputFailure.WriteFailed(target, "output stream reported an error"));
        }
    }

    private static void header(StringBuilder sb, String title) {
        sb.append(RULE).append("\n");
        sb.append(title == null ? "" : title).append("\n");
        sb.append(RULE).append("\n");
    }

    private static String status(boolean active, boolean closed) {
        if (closed) {
            return "closed";
        }
        return active ? "active" : "inactive";
    }

    private static String timestamp(Instant instant) {
        return instant == null ? NOT_AVAILABLE : DISPLAY_TS.format(instant);
    }

    private static String price(String dataType, String field, Double value) {
        return number(dataType, field, value, "%.4f");
    }

    private static String ratio(String dataType, String field, Double value) {
        return number(dataType, field, value, "%.2f");
    }

    private static String money(String dataType, String field, Double value) {
        return number(dataType, field, value, "$%,.2f");
    }

    private static String percent(String dataType, String field, Double value) {
        if (value == null) {
            return NOT_AVAILABLE;
        }
        return number(dataType, field, value * 100.0, "%.2f%%");
    }

    private static String number(String dataType, String field, Double value, String pattern) {
        if (value == null) {
            return NOT_AVAILABLE;
        }
        if (!Double.isFinite(value)) {
            throw new PipelineException(new OutputFailure.FormattingFailed(
                    dataType, field + " is not a finite number (" + value + ")"));
        }
        return String.format(Locale.ROOT, pattern, value);
    }
}
