package com.polyexplorer.polymarket;

import com.polyexplorer.config.Config;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.core.error.SourceFailure;
import com.polyexplorer.data.http.HttpClientEx;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.MarketGroup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fetches, parses and standardizes Polymarket market groups.
 */
public final class PolymarketService {
    private static final Logger LOG = LogManager.getLogger(PolymarketService.class);

    private final GammaApiClient api;
    private final GammaResponseParser parser;
    private final MarketStandardizer standardizer;

    public PolymarketService(Config config, HttpClientEx http) {
        this(
                new GammaApiClient(config, http),
                new GammaResponseParser(config.getInt("display.snippet_max_len")),
                new MarketStandardizer()
        );
    }

    public PolymarketService(GammaApiClient api, GammaResponseParser parser, MarketStandardizer standardizer) {
        this.api = api;
        this.parser = parser;
        this.standardizer = standardizer;
    }

    /**
     * Fetches the event group {@code slug} and returns it standardized.
     *
     * @throws com.polyexplorer.core.error.PipelineException from whichever stage failed first
     */
    public MarketGroup loadGroup(String slug) {
        String body = api.fetchEventJson(slug);
        GammaEvent event = parser.parseEvent(body);
        MarketGroup group = standardizer.standardizeGroup(event);
        LOG.info("loaded market group {} with {} markets", group.getSlug(), group.getMarkets().size());
        return group;
    }

    /**
     * Looks up a market of {@code group} by exact slug.
     *
     * @throws com.polyexplorer.core.error.PipelineException with {@code MarketNotFound} when absent
     */
    public Market findMarket(MarketGroup group, String marketSlug) {
        for (Market market : group.getMarkets()) {
            if (market.getSlug().equals(marketSlug)) {
                return market;
            }
        }
        throw new PipelineException(new SourceFailure.MarketNotFound(group.getSlug(), marketSlug));
    }
}
