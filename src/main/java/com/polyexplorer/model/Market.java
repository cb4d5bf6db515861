package com.polyexplorer.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical binary (YES/NO) market. {@code bestBid}/{@code bestAsk} are null when the order book
 * has no quote; {@code updatedAt}/{@code endDate} are null when the source omits them.
 */
@Value
@Builder
public class Market {
    String slug;
    String question;
    String conditionId;
    String yesTokenId;
    String noTokenId;
    double yesPrice;
    double noPrice;
    boolean active;
    boolean closed;
    double volume;
    double volume24h;
    double volume1w;
    double volume1m;
    double volume1y;
    double liquidity;
    double lastTradePrice;
    Double bestBid;
    Double bestAsk;
    Instant updatedAt;
    Instant endDate;

    public boolean ownsToken(String tokenId) {
        return tokenId != null && (tokenId.equals(yesTokenId) || tokenId.equals(noTokenId));
    }
}
