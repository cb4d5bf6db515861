package com.polyexplorer.analysis;

import com.polyexplorer.core.error.AnalysisFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.Position;
import com.polyexplorer.model.PositionExposure;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Aggregates trader positions held in one market. A position belongs to the market when its
 * market id equals the market's condition id or slug.
 */
public final class PositionAnalyzer {
    private static final Logger LOG = LogManager.getLogger(PositionAnalyzer.class);

    static final String ANALYSIS_TYPE = "position";

    /**
     * Sums holders, shares, cost basis and mark value of the positions held in {@code market}.
     * Positions for other markets are ignored.
     *
     * @param market    market whose token ids and prices are used
     * @param positions all loaded positions; may be null
     * @return exposure of the matching positions
     * @throws com.polyexplorer.core.error.PipelineException with {@code InvalidPosition} for a
     *                                                       malformed position, {@code InsufficientData}
     *                                                       when none match, or
     *                                                       {@code CalculationFailed} when the
     *                                                       matching positions hold no shares
     */
    public PositionExposure exposure(Market market, List<Position> positions) {
        List<Position> held = new ArrayList<>();
        if (positions != null) {
            for (Position position : positions) {
                if (belongsTo(position, market)) {
                    held.add(position);
                }
            }
        }
        if (held.isEmpty()) {
            throw new PipelineException(new AnalysisFailure.InsufficientData(
                    ANALYSIS_TYPE, "no positions recorded for market '" + market.getSlug() + "'"));
        }

        Set<String> holders = new HashSet<>();
        double yesShares = 0.0;
        double noShares = 0.0;
        double costBasis = 0.0;
        double markValue = 0.0;
        for (Position position : held) {
            boolean yes = validate(position, market);
            double shares = position.getSharesHeld();
            holders.add(position.getTraderAddress());
            if (yes) {
                yesShares += shares;
                markValue += shares * market.getYesPrice();
            } else {
                noShares += shares;
                markValue += shares * market.getNoPrice();
            }
            costBasis += shares * position.getAvgEntryPrice();
        }

        double total = yesShares + noShares;
        if (total <= 0.0) {
            throw new PipelineException(new AnalysisFailure.CalculationFailed(
                    ANALYSIS_TYPE, "total shares held in '" + market.getSlug() + "' is zero"));
        }

        LOG.debug("aggregated {} positions of {} holders in {}", held.size(), holders.size(), market.getSlug());
        return PositionExposure.builder()
                .marketSlug(market.getSlug())
                .holders(holders.size())
                .positions(held.size())
                .yesShares(yesShares)
                .noShares(noShares)
                .yesShareRatio(yesShares / total)
                .costBasis(costBasis)
                .markValue(markValue)
                .unrealizedPnl(markValue - costBasis)
                .build();
    }

    /** True when at least one position belongs to {@code market}. */
    public boolean hasPositions(Market market, List<Position> positions) {
        if (positions == null) {
            return false;
        }
        for (Position position : positions) {
            if (belongsTo(position, market)) {
                return true;
            }
        }
        return false;
    }

    private static boolean belongsTo(Position position, Market market) {
        String marketId = position.getMarketId();
        return marketId != null && (marketId.equals(market.getConditionId()) || marketId.equals(market.getSlug()));
    }

    /**
     * @return true for a YES position, false for NO
     */
    private static boolean validate(Position position, Market market) {
        String side = position.getSide() == null ? "" : position.getSide().trim().toUpperCase(Locale.ROOT);
        if (!side.equals("YES") && !side.equals("NO")) {
            throw invalid(position, "side must be YES or NO, got '" + position.getSide() + "'");
        }
        if (position.getSharesHeld() < 0.0) {
            throw invalid(position, "shares held is negative: " + position.getSharesHeld());
        }
        double entry = position.getAvgEntryPrice();
        if (entry < 0.0 || entry > 1.0) {
            throw invalid(position, "average entry price " + entry + " is outside [0, 1]");
        }
        if (!market.ownsToken(position.getTokenId())) {
            throw invalid(position, "token does not belong to market '" + market.getSlug() + "'");
        }
        boolean yes = side.equals("YES");
        String expectedToken = yes ? market.getYesTokenId() : market.getNoTokenId();
        if (!expectedToken.equals(position.getTokenId())) {
            throw invalid(position, "side " + side + " does not match the token's outcome");
        }
        return yes;
    }

    private static PipelineException invalid(Position position, String reason) {
        return new PipelineException(new AnalysisFailure.InvalidPosition(position.positionId(), reason));
    }
}
