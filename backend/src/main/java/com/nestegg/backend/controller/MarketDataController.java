package com.nestegg.backend.controller;

import com.nestegg.backend.dto.QuoteDTO;
import com.nestegg.backend.dto.SymbolSearchResultDTO;
import com.nestegg.backend.exception.BadRequestException;
import com.nestegg.backend.exception.QuoteUnavailableException;
import com.nestegg.backend.service.PriceCacheService;
import com.nestegg.backend.service.marketdata.MarketDataClient;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/market")
@RequiredArgsConstructor
@Tag(name = "Market Data")
public class MarketDataController {

    private static final int SEARCH_LIMIT = 10;

    private final MarketDataClient marketDataClient;
    private final PriceCacheService priceCacheService;

    @GetMapping("/search")
    @Operation(summary = "Search symbols by ticker or company name")
    public ResponseEntity<List<SymbolSearchResultDTO>> search(@RequestParam("query") String query) {
        if (!StringUtils.hasText(query)) {
            throw new BadRequestException("Query is required");
        }
        return ResponseEntity.ok(marketDataClient.search(query.trim(), SEARCH_LIMIT));
    }

    @GetMapping("/quote/{symbol}")
    @Operation(summary = "Current price for a symbol, served from the price cache when fresh")
    public ResponseEntity<QuoteDTO> quote(@PathVariable String symbol) {
        String normalized = symbol.trim().toUpperCase(Locale.ROOT);
        PriceCacheService.CachedPrice quote = priceCacheService.currentQuote(normalized)
                .orElseThrow(() -> new QuoteUnavailableException(normalized));
        return ResponseEntity.ok(QuoteDTO.builder()
                .symbol(normalized)
                .price(quote.price())
                .fetchedAt(quote.fetchedAt())
                .build());
    }
}
