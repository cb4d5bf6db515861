package com.polyexplorer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Derived market statistics. Nullable metrics are the ones whose inputs the market may lack.
 */
@Value
@Builder
public class MarketSummary {
    String marketSlug;
    double impliedProbability;
    double overround;
    Double spread;
    Double midPrice;
    Double volume24hShareOfWeek;
    Double volumeToLiquidity;
}
