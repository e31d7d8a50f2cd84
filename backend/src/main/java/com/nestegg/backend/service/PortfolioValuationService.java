package com.nestegg.backend.service;

import com.nestegg.backend.model.Sandbox;
import com.nestegg.backend.model.SandboxLot;
import com.nestegg.backend.repository.SandboxLotRepository;
import com.nestegg.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Marks sandboxes to market at current cached prices. A lot whose price cannot be fetched
 * is valued at its own average cost and flagged stale.
 */
@Service
@RequiredArgsConstructor
public class PortfolioValuationService {

    private final SandboxLotRepository lotRepository;
    private final PriceCacheService priceCacheService;

    public PortfolioValuation value(Sandbox sandbox) {
        List<SandboxLot> lots = lotRepository.findBySandboxIdOrderBySymbolAsc(sandbox.getId());
        return value(sandbox.getCashBalance(), lots, priceCacheService.currentPrices(fallbacks(lots)));
    }

    /**
     * Values several sandboxes with one price lookup per distinct symbol.
     */
    public Map<Long, PortfolioValuation> valueAll(Collection<Sandbox> sandboxes) {
        if (sandboxes.isEmpty()) {
            return Map.of();
        }
        List<Long> ids = sandboxes.stream().map(Sandbox::getId).collect(Collectors.toList());
        Map<Long, List<SandboxLot>> lotsBySandbox = lotRepository.findBySandboxIdIn(ids).stream()
                .collect(Collectors.groupingBy(SandboxLot::getSandboxId));
        List<SandboxLot> allLots = lotsBySandbox.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toList());
        Map<String, PriceCacheService.LivePrice> prices = priceCacheService.currentPrices(fallbacks(allLots));
        Map<Long, PortfolioValuation> valuations = new LinkedHashMap<>();
        for (Sandbox sandbox : sandboxes) {
            valuations.put(sandbox.getId(),
                    value(sandbox.getCashBalance(), lotsBySandbox.getOrDefault(sandbox.getId(), List.of()), prices));
        }
        return valuations;
    }

    private PortfolioValuation value(BigDecimal cash, List<SandboxLot> lots, Map<String, PriceCacheService.LivePrice> prices) {
        List<LotValuation> lotValuations = new ArrayList<>();
        BigDecimal holdings = MoneyUtils.ZERO;
        for (SandboxLot lot : lots) {
            PriceCacheService.LivePrice live = prices.get(lot.getSymbol());
            boolean stale = live == null || live.stale();
            BigDecimal price = stale ? MoneyUtils.scale(lot.getAverageCost()) : live.price();
            BigDecimal value = MoneyUtils.notional(price, lot.getQuantity());
            holdings = MoneyUtils.add(holdings, value);
            lotValuations.add(new LotValuation(lot, price, value, stale));
        }
        BigDecimal scaledCash = MoneyUtils.scale(cash);
        return new PortfolioValuation(scaledCash, holdings, MoneyUtils.add(scaledCash, holdings), lotValuations);
    }

    private Map<String, BigDecimal> fallbacks(List<SandboxLot> lots) {
        Map<String, BigDecimal> fallbacks = new LinkedHashMap<>();
        for (SandboxLot lot : lots) {
            fallbacks.putIfAbsent(lot.getSymbol(), MoneyUtils.scale(lot.getAverageCost()));
        }
        return fallbacks;
    }

    public record PortfolioValuation(BigDecimal cash, BigDecimal holdingsValue, BigDecimal totalEquity,
                                     List<LotValuation> lots) {
    }

    public record LotValuation(SandboxLot lot, BigDecimal price, BigDecimal value, boolean stale) {
    }
}
