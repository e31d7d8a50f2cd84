package com.nestegg.backend.service.marketdata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nestegg.backend.config.SandboxProperties;
import com.nestegg.backend.dto.SymbolSearchResultDTO;
import com.nestegg.backend.exception.MarketDataException;
import com.nestegg.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class YahooMarketDataClient implements MarketDataClient {

    private final MarketDataHttpClient marketDataHttpClient;
    private final SandboxProperties sandboxProperties;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Value("${market-data.base-url:https://query1.finance.yahoo.com}")
    private String baseUrl;

    @Value("${market-data.search-url:https://query2.finance.yahoo.com}")
    private String searchUrl;

    @Override
    public Optional<BigDecimal> currentPrice(String symbol) {
        String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path("/v8/finance/chart/{symbol}")
                .queryParam("range", "1d")
                .queryParam("interval", "1d")
                .encode()
                .buildAndExpand(symbol)
                .toUriString();
        try {
            JsonNode result = chartResult(marketDataHttpClient.get(url, "quote"));
            Optional<QuotePriceExtractor.PricedBy> priced =
                    QuotePriceExtractor.firstAvailable(QuotePriceExtractor.DEFAULT_ORDER, result);
            if (priced.isEmpty()) {
                log.warn("No usable price in quote response for {}", symbol);
                return Optional.empty();
            }
            log.debug("Priced {} at {} via {}", symbol, priced.get().price(), priced.get().source());
            return Optional.of(priced.get().price());
        } catch (MarketDataException e) {
            log.warn("Failed to fetch quote for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public Map<String, NavigableMap<LocalDate, BigDecimal>> historicalDailyCloses(Collection<String> symbols, LocalDate start) {
        long period1 = start.atStartOfDay(sandboxProperties.zoneId()).toEpochSecond();
        long period2 = Instant.now(clock).plusSeconds(86_400).getEpochSecond();
        Map<String, NavigableMap<LocalDate, BigDecimal>> closes = new LinkedHashMap<>();
        for (String symbol : symbols) {
            String url = UriComponentsBuilder.fromHttpUrl(baseUrl)
                    .path("/v8/finance/chart/{symbol}")
                    .queryParam("period1", period1)
                    .queryParam("period2", period2)
                    .queryParam("interval", "1d")
                    .encode()
                    .buildAndExpand(symbol)
                    .toUriString();
            try {
                closes.put(symbol, parseDailyCloses(chartResult(marketDataHttpClient.getWithRetry(url, "history"))));
            } catch (MarketDataException e) {
                if (e.getStatusCode() == 404) {
                    log.warn("No price history for {}", symbol);
                    closes.put(symbol, new TreeMap<>());
                } else {
                    throw e;
                }
            }
        }
        return closes;
    }

    @Override
    public List<SymbolSearchResultDTO> search(String query, int limit) {
        String url = UriComponentsBuilder.fromHttpUrl(searchUrl)
                .path("/v1/finance/search")
                .queryParam("q", "{query}")
                .queryParam("quotesCount", limit)
                .queryParam("newsCount", 0)
                .encode()
                .buildAndExpand(query)
                .toUriString();
        JsonNode quotes = readTree(marketDataHttpClient.getWithRetry(url, "search")).path("quotes");
        if (!quotes.isArray()) {
            return Collections.emptyList();
        }
        List<SymbolSearchResultDTO> results = new ArrayList<>();
        for (JsonNode quote : quotes) {
            String symbol = quote.path("symbol").asText("");
            if (symbol.isBlank()) {
                continue;
            }
            results.add(SymbolSearchResultDTO.builder()
                    .symbol(symbol)
                    .name(firstNonBlank(quote, "longname", "shortname"))
                    .exchange(firstNonBlank(quote, "exchDisp", "exchange"))
                    .type(firstNonBlank(quote, "typeDisp", "quoteType"))
                    .build());
            if (results.size() >= limit) {
                break;
            }
        }
        return results;
    }

    NavigableMap<LocalDate, BigDecimal> parseDailyCloses(JsonNode result) {
        NavigableMap<LocalDate, BigDecimal> series = new TreeMap<>();
        JsonNode timestamps = result.path("timestamp");
        JsonNode closes = result.path("indicators").path("quote").path(0).path("close");
        if (!timestamps.isArray() || !closes.isArray()) {
            return series;
        }
        ZoneId zone = exchangeZone(result.path("meta"));
        int points = Math.min(timestamps.size(), closes.size());
        for (int i = 0; i < points; i++) {
            JsonNode close = closes.get(i);
            if (close == null || !close.isNumber()) {
                continue;
            }
            LocalDate day = Instant.ofEpochSecond(timestamps.get(i).asLong()).atZone(zone).toLocalDate();
            series.put(day, MoneyUtils.scale(close.decimalValue()));
        }
        return series;
    }

    private ZoneId exchangeZone(JsonNode meta) {
        String zoneName = meta.path("exchangeTimezoneName").asText("");
        if (!zoneName.isBlank()) {
            try {
                return ZoneId.of(zoneName);
            } catch (DateTimeException e) {
                log.debug("Unknown exchange zone {}, using {}", zoneName, sandboxProperties.getZone());
            }
        }
        return sandboxProperties.zoneId();
    }

    private JsonNode chartResult(String body) {
        JsonNode chart = readTree(body).path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new MarketDataException("Chart error: " + error.path("description").asText(error.toString()));
        }
        return chart.path("result").path(0);
    }

    private JsonNode readTree(String body) {
        if (body == null || body.isBlank()) {
            throw new MarketDataException("Empty market data response");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MarketDataException("Unparseable market data response", e);
        }
    }

    private String firstNonBlank(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText("");
            if (!value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
