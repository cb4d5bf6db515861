package com.polyexplorer.model;

import lombok.Builder;
import lombok.Value;

/**
 * Shares of one outcome token held by one trader. {@code firstEntryBlock} is null when unknown.
 */
@Value
@Builder
public class Position {
    String traderAddress;
    String tokenId;
    String marketId;
    String side;
    double sharesHeld;
    double avgEntryPrice;
    Long firstEntryBlock;

    public String positionId() {
        return traderAddress + "@" + tokenId;
    }
}
