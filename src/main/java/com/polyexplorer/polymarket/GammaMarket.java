package com.polyexplorer.polymarket;

import java.time.Instant;
import java.util.List;

/**
 * One market inside a Gamma event. Gamma encodes {@code outcomes}, {@code outcomePrices} and
 * {@code clobTokenIds} as JSON arrays inside strings; here they are already decoded.
 */
public record GammaMarket(
        String question,
        String conditionId,
        String slug,
        List<String> outcomes,
        List<Double> outcomePrices,
        List<String> clobTokenIds,
        boolean active,
        boolean closed,
        double volumeNum,
        double volume24hr,
        double volume1wk,
        double volume1mo,
        double volume1yr,
        double liquidityNum,
        double lastTradePrice,
        Double bestBid,
        Double bestAsk,
        Instant updatedAt,
        Instant endDate
) {
    public GammaMarket {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
        outcomePrices = outcomePrices == null ? List.of() : List.copyOf(outcomePrices);
        clobTokenIds = clobTokenIds == null ? List.of() : List.copyOf(clobTokenIds);
    }
}
