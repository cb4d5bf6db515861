package com.polyexplorer.analysis;

import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.AnalysisFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.MarketSummary;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Derives price and volume statistics for a single standardized market.
 */
public final class MarketAnalyzer {
    private static final Logger LOG = LogManager.getLogger(MarketAnalyzer.class);

    static final String ANALYSIS_TYPE = "market";

    private final Duration maxAge;
    private final double maxOverround;
    private final Clock clock;

    /**
     * Reads {@code analysis.max_age_hours} and {@code analysis.max_overround}.
     */
    public MarketAnalyzer(Config config, Clock clock) {
        this(config.getHours("analysis.max_age_hours", 24), config.getDouble("analysis.max_overround"), clock);
    }

    public MarketAnalyzer(Duration maxAge, double maxOverround, Clock clock) {
        if (maxAge == null || maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be non-negative");
        }
        if (!Double.isFinite(maxOverround) || maxOverround < 0.0) {
            throw new IllegalArgumentException("maxOverround must be a finite non-negative number");
        }
        this.maxAge = maxAge;
        this.maxOverround = maxOverround;
        this.clock = clock;
    }

    /**
     * Computes the summary of one market. Checks run in order: activity, freshness, calculation,
     * overround bound; the first one that fails is raised.
     *
     * @param market standardized market
     * @return summary with null for metrics that have no defined value
     * @throws com.polyexplorer.core.error.PipelineException carrying an analysis failure
     */
    public MarketSummary summarize(Market market) {
        if (market.getVolume() <= 0.0 && market.getLiquidity() <= 0.0) {
            throw new PipelineException(new AnalysisFailure.InsufficientData(
                    ANALYSIS_TYPE, "market '" + market.getSlug() + "' has neither volume nor liquidity"));
        }
        checkFreshness(market);

        double priceSum = market.getYesPrice() + market.getNoPrice();
        if (priceSum <= 0.0) {
            throw new PipelineException(new AnalysisFailure.CalculationFailed(
                    ANALYSIS_TYPE, "YES and NO prices of '" + market.getSlug() + "' sum to zero"));
        }
        double overround = priceSum - 1.0;
        if (Math.abs(overround) > maxOverround) {
            throw new PipelineException(new AnalysisFailure.StatisticalError(
                    ANALYSIS_TYPE,
                    String.format("YES + NO prices of '%s' deviate from 1 by %.4f (allowed %.4f)",
                            market.getSlug(), overround, maxOverround)));
        }

        Double spread = null;
        Double midPrice = null;
        if (market.getBestBid() != null && market.getBestAsk() != null) {
            spread = finite("spread", market.getBestAsk() - market.getBestBid());
            midPrice = finite("mid price", (market.getBestAsk() + market.getBestBid()) / 2.0);
        }
        Double weeklyShare = market.getVolume1w() > 0.0
                ? finite("24h share of weekly volume", market.getVolume24h() / market.getVolume1w())
                : null;
        Double turnover = market.getLiquidity() > 0.0
                ? finite("volume to liquidity", market.getVolume() / market.getLiquidity())
                : null;

        MarketSummary summary = MarketSummary.builder()
                .marketSlug(market.getSlug())
                .impliedProbability(finite("implied probability", market.getYesPrice() / priceSum))
                .overround(overround)
                .spread(spread)
                .midPrice(midPrice)
                .volume24hShareOfWeek(weeklyShare)
                .volumeToLiquidity(turnover)
                .build();
        LOG.debug("summarized market {}: p={}", market.getSlug(), summary.getImpliedProbability());
        return summary;
    }

    private void checkFreshness(Market market) {
        Instant updatedAt = market.getUpdatedAt();
        if (!market.isActive() || updatedAt == null) {
            return;
        }
        Duration age = Duration.between(updatedAt, clock.instant());
        if (age.compareTo(maxAge) > 0) {
            throw new PipelineException(new AnalysisFailure.StaleData(ANALYSIS_TYPE, age, maxAge));
        }
    }

    private static double finite(String metric, double value) {
        if (!Double.isFinite(value)) {
            throw new PipelineException(new AnalysisFailure.CalculationFailed(
                    ANALYSIS_TYPE, metric + " is not a finite number"));
        }
        return value;
    }
}
