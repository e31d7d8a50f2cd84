package com.nestegg.backend.service.marketdata;

import com.nestegg.backend.dto.SymbolSearchResultDTO;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

public interface MarketDataClient {

    /**
     * Latest price for {@code symbol}, or empty when the provider has none or the call failed.
     */
    Optional<BigDecimal> currentPrice(String symbol);

    /**
     * Daily closes from {@code start} through today for every symbol. Symbols the provider
     * knows nothing about map to an empty series.
     *
     * @throws com.nestegg.backend.exception.MarketDataException when the provider cannot be reached
     */
    Map<String, NavigableMap<LocalDate, BigDecimal>> historicalDailyCloses(Collection<String> symbols, LocalDate start);

    List<SymbolSearchResultDTO> search(String query, int limit);
}
