package com.nestegg.backend.service.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.nestegg.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One named way of pulling a current price out of a chart response. The client tries
 * {@link #DEFAULT_ORDER} in sequence and takes the first positive value.
 */
public record QuotePriceExtractor(String name, Function<JsonNode, Optional<BigDecimal>> extractor) {

    public static final QuotePriceExtractor REGULAR_MARKET_PRICE =
            new QuotePriceExtractor("regularMarketPrice", result -> positive(result.path("meta").path("regularMarketPrice")));

    public static final QuotePriceExtractor CURRENT_PRICE =
            new QuotePriceExtractor("currentPrice", result -> positive(result.path("meta").path("currentPrice")));

    public static final QuotePriceExtractor LAST_CLOSE =
            new QuotePriceExtractor("lastClose", QuotePriceExtractor::lastNonNullClose);

    public static final List<QuotePriceExtractor> DEFAULT_ORDER = List.of(REGULAR_MARKET_PRICE, CURRENT_PRICE, LAST_CLOSE);

    public Optional<BigDecimal> extract(JsonNode chartResult) {
        if (chartResult == null || chartResult.isMissingNode() || chartResult.isNull()) {
            return Optional.empty();
        }
        return extractor.apply(chartResult);
    }

    public static Optional<PricedBy> firstAvailable(List<QuotePriceExtractor> extractors, JsonNode chartResult) {
        for (QuotePriceExtractor candidate : extractors) {
            Optional<BigDecimal> price = candidate.extract(chartResult);
            if (price.isPresent()) {
                return Optional.of(new PricedBy(candidate.name(), price.get()));
            }
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> lastNonNullClose(JsonNode result) {
        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        if (!closes.isArray()) {
            return Optional.empty();
        }
        for (int i = closes.size() - 1; i >= 0; i--) {
            Optional<BigDecimal> close = positive(closes.get(i));
            if (close.isPresent()) {
                return close;
            }
        }
        return Optional.empty();
    }

    private static Optional<BigDecimal> positive(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return Optional.empty();
        }
        BigDecimal value = MoneyUtils.scale(node.decimalValue());
        return value.signum() > 0 ? Optional.of(value) : Optional.empty();
    }

    public record PricedBy(String source, BigDecimal price) {
    }
}
