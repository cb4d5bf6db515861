package com.polyexplorer.polymarket;

import java.util.List;

/**
 * Event payload from {@code /events/slug/{slug}}, as typed by {@link GammaResponseParser}.
 */
public record GammaEvent(
        String slug,
        String title,
        boolean active,
        boolean closed,
        double volume,
        double liquidity,
        List<GammaMarket> markets
) {
    public GammaEvent {
        markets = markets == null ? List.of() : List.copyOf(markets);
    }
}
