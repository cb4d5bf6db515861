package com.polyexplorer.polymarket;

import com.polyexplorer.core.error.NormalizationFailure;
import com.polyexplorer.core.error.PipelineException;
import com.polyexplorer.model.Market;
import com.polyexplorer.model.MarketGroup;

import java.util.List;
import java.util.Locale;

/**
 * Converts typed Gamma payloads into canonical {@link MarketGroup}/{@link Market} values and checks
 * their consistency. Every failure is scoped to one market slug.
 */
public final class MarketStandardizer {

    /**
     * Standardizes every market of the event in payload order. Group totals are carried through
     * as parsed; the parser has already rejected negative or non-finite ones.
     *
     * @throws com.polyexplorer.core.error.PipelineException with a normalization failure naming
     *                                                       the first inconsistent market
     */
    public MarketGroup standardizeGroup(GammaEvent raw) {
        MarketGroup.MarketGroupBuilder group = MarketGroup.builder()
                .slug(raw.slug())
                .title(raw.title())
                .active(raw.active())
                .closed(raw.closed())
                .volume(raw.volume())
                .liquidity(raw.liquidity());
        List<GammaMarket> markets = raw.markets();
        for (int i = 0; i < markets.size(); i++) {
            group.market(standardizeMarket(markets.get(i), raw.slug() + "[" + i + "]"));
        }
        return group.build();
    }

    /**
     * @param fallbackId identifier used in failures when the market carries neither slug nor
     *                   condition id
     */
    public Market standardizeMarket(GammaMarket raw, String fallbackId) {
        String slug = trim(raw.slug());
        String conditionId = trim(raw.conditionId());
        String id = !slug.isEmpty() ? slug : (!conditionId.isEmpty() ? conditionId : fallbackId);

        if (slug.isEmpty()) {
            throw new PipelineException(new NormalizationFailure.EmptyRequiredField(id, "slug"));
        }
        if (trim(raw.question()).isEmpty()) {
            throw new PipelineException(new NormalizationFailure.EmptyRequiredField(id, "question"));
        }
        if (conditionId.isEmpty()) {
            throw new PipelineException(new NormalizationFailure.EmptyRequiredField(id, "conditionId"));
        }

        int yesIdx = indexOfOutcome(raw.outcomes(), "yes");
        int noIdx = indexOfOutcome(raw.outcomes(), "no");
        if (raw.outcomes().size() != 2 || yesIdx < 0 || noIdx < 0) {
            throw new PipelineException(new NormalizationFailure.OutcomeMappingFailed(
                    id, raw.outcomes(), "expected exactly the outcomes YES and NO"));
        }

        List<String> tokens = raw.clobTokenIds();
        if (tokens.size() != 2) {
            throw new PipelineException(new NormalizationFailure.TokenIdExtractionFailed(
                    id, "expected 2 CLOB token ids, got " + tokens.size()));
        }
        for (int i = 0; i < tokens.size(); i++) {
            if (trim(tokens.get(i)).isEmpty()) {
                throw new PipelineException(new NormalizationFailure.TokenIdExtractionFailed(
                        id, "token id at position " + i + " is empty"));
            }
        }
        if (trim(tokens.get(0)).equals(trim(tokens.get(1)))) {
            throw new PipelineException(new NormalizationFailure.TokenIdExtractionFailed(
                    id, "YES and NO share the same token id"));
        }

        if (raw.outcomePrices().size() != raw.outcomes().size()) {
            throw new PipelineException(new NormalizationFailure.InvalidPriceData(id, "outcomePrices",
                    "expected " + raw.outcomes().size() + " prices, got " + raw.outcomePrices().size()));
        }
        double yesPrice = requirePrice(id, "outcomePrices[" + yesIdx + "]", raw.outcomePrices().get(yesIdx));
        double noPrice = requirePrice(id, "outcomePrices[" + noIdx + "]", raw.outcomePrices().get(noIdx));
        requirePrice(id, "lastTradePrice", raw.lastTradePrice());
        if (raw.bestBid() != null) {
            requirePrice(id, "bestBid", raw.bestBid());
        }
        if (raw.bestAsk() != null) {
            requirePrice(id, "bestAsk", raw.bestAsk());
        }
        if (raw.bestBid() != null && raw.bestAsk() != null && raw.bestBid() > raw.bestAsk()) {
            throw new PipelineException(new NormalizationFailure.ValidationFailed(
                    id, "best bid " + raw.bestBid() + " is above best ask " + raw.bestAsk()));
        }

        requireVolume(id, "volumeNum", raw.volumeNum());
        requireVolume(id, "volume24hr", raw.volume24hr());
        requireVolume(id, "volume1wk", raw.volume1wk());
        requireVolume(id, "volume1mo", raw.volume1mo());
        requireVolume(id, "volume1yr", raw.volume1yr());
        requireVolume(id, "liquidityNum", raw.liquidityNum());

        return Market.builder()
                .slug(slug)
                .question(raw.question().trim())
                .conditionId(conditionId)
                .yesTokenId(trim(tokens.get(yesIdx)))
                .noTokenId(trim(tokens.get(noIdx)))
                .yesPrice(yesPrice)
                .noPrice(noPrice)
                .active(raw.active())
                .closed(raw.closed())
                .volume(raw.volumeNum())
                .volume24h(raw.volume24hr())
                .volume1w(raw.volume1wk())
                .volume1m(raw.volume1mo())
                .volume1y(raw.volume1yr())
                .liquidity(raw.liquidityNum())
                .lastTradePrice(raw.lastTradePrice())
                .bestBid(raw.bestBid())
                .bestAsk(raw.bestAsk())
                .updatedAt(raw.updatedAt())
                .endDate(raw.endDate())
                .build();
    }

    private double requirePrice(String marketSlug, String field, double price) {
        if (!Double.isFinite(price) || price < 0.0 || price > 1.0) {
            throw new PipelineException(new NormalizationFailure.InvalidPriceData(
                    marketSlug, field, "price " + price + " is outside [0, 1]"));
        }
        return price;
    }

    private void requireVolume(String marketSlug, String field, double volume) {
        if (!Double.isFinite(volume)) {
            throw new PipelineException(new NormalizationFailure.InvalidVolumeData(
                    marketSlug, field, "value is not finite"));
        }
        if (volume < 0.0) {
            throw new PipelineException(new NormalizationFailure.InvalidVolumeData(
                    marketSlug, field, "negative value " + volume));
        }
    }

    private static int indexOfOutcome(List<String> outcomes, String target) {
        for (int i = 0; i < outcomes.size(); i++) {
            if (trim(outcomes.get(i)).toLowerCase(Locale.ROOT).equals(target)) {
                return i;
            }
        }
        return -1;
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
