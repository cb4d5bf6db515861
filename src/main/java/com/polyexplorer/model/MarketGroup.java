package com.polyexplorer.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A Polymarket event: a group of related markets sharing one slug.
 */
@Value
@Builder
public class MarketGroup {
    String slug;
    String title;
    boolean active;
    boolean closed;
    double volume;
    double liquidity;
    @Singular
    List<Market> markets;
}
