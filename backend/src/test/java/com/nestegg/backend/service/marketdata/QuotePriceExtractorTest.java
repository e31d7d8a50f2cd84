package com.nestegg.backend.service.marketdata;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class QuotePriceExtractorTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void regularMarketPriceWinsWhenPresent() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"meta": {"regularMarketPrice": 187.5, "currentPrice": 180},
                 "indicators": {"quote": [{"close": [170.0]}]}}
                """);

        assertThat(QuotePriceExtractor.firstAvailable(QuotePriceExtractor.DEFAULT_ORDER, result))
                .hasValueSatisfying(priced -> {
                    assertThat(priced.source()).isEqualTo("regularMarketPrice");
                    assertThat(priced.price()).isEqualByComparingTo("187.5");
                });
    }

    @Test
    void fallsThroughToLastNonNullClose() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"meta": {"regularMarketPrice": 0},
                 "indicators": {"quote": [{"close": [101.25, 102.5, null]}]}}
                """);

        assertThat(QuotePriceExtractor.firstAvailable(QuotePriceExtractor.DEFAULT_ORDER, result))
                .hasValueSatisfying(priced -> {
                    assertThat(priced.source()).isEqualTo("lastClose");
                    assertThat(priced.price()).isEqualByComparingTo("102.5");
                });
    }

    @Test
    void eachExtractorWorksAlone() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"meta": {"currentPrice": 42.1}}
                """);

        assertThat(QuotePriceExtractor.CURRENT_PRICE.extract(result)).contains(new BigDecimal("42.1000"));
        assertThat(QuotePriceExtractor.REGULAR_MARKET_PRICE.extract(result)).isEmpty();
        assertThat(QuotePriceExtractor.LAST_CLOSE.extract(result)).isEmpty();
    }

    @Test
    void orderIsConfigurable() throws Exception {
        JsonNode result = objectMapper.readTree("""
                {"meta": {"regularMarketPrice": 10, "currentPrice": 11}}
                """);

        assertThat(QuotePriceExtractor.firstAvailable(
                List.of(QuotePriceExtractor.CURRENT_PRICE, QuotePriceExtractor.REGULAR_MARKET_PRICE), result))
                .hasValueSatisfying(priced -> assertThat(priced.price()).isEqualByComparingTo("11"));
    }

    @Test
    void missingResultYieldsNothing() {
        assertThat(QuotePriceExtractor.firstAvailable(QuotePriceExtractor.DEFAULT_ORDER,
                objectMapper.missingNode())).isEmpty();
    }
}
