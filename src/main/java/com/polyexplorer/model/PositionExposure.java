package com.polyexplorer.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PositionExposure {
    String marketSlug;
    int holders;
    int positions;
    double yesShares;
    double noShares;
    double yesShareRatio;
    double costBasis;
    double markValue;
    double unrealizedPnl;
}
