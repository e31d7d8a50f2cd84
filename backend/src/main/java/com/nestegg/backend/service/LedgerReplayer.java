package com.nestegg.backend.service;

import com.nestegg.backend.model.SandboxTransaction;
import com.nestegg.backend.model.TradeSide;
import com.nestegg.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Rebuilds day-by-day cash and holdings from a transaction log and values each day at
 * gap-filled closing prices. Pure: same inputs, same output.
 */
public class LedgerReplayer {

    private final ZoneId zone;
    private final BigDecimal lotEpsilon;

    public LedgerReplayer(ZoneId zone, BigDecimal lotEpsilon) {
        this.zone = zone;
        this.lotEpsilon = lotEpsilon;
    }

    /**
     * @param transactions log in execution order; ties keep list order
     * @param closes       per-symbol series covering {@code [from, to]}; a missing or empty
     *                     series values that symbol at zero
     */
    public List<DailyEquity> replay(BigDecimal initialCash, List<SandboxTransaction> transactions,
                                    LocalDate from, LocalDate to, Map<String, PriceSeries> closes) {
        List<SandboxTransaction> ordered = new ArrayList<>(transactions);
        ordered.sort(Comparator.comparing(SandboxTransaction::getExecutedAt));

        BigDecimal cash = MoneyUtils.scale(initialCash);
        Map<String, BigDecimal> holdings = new TreeMap<>();
        List<DailyEquity> days = new ArrayList<>();
        int next = 0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            while (next < ordered.size() && !tradeDate(ordered.get(next)).isAfter(day)) {
                SandboxTransaction tx = ordered.get(next++);
                if (tx.getSide() == TradeSide.BUY) {
                    cash = MoneyUtils.subtract(cash, tx.getTotal());
                    holdings.merge(tx.getSymbol(), tx.getQuantity(), BigDecimal::add);
                } else {
                    cash = MoneyUtils.add(cash, tx.getTotal());
                    BigDecimal remaining = holdings.getOrDefault(tx.getSymbol(), BigDecimal.ZERO).subtract(tx.getQuantity());
                    if (remaining.compareTo(lotEpsilon) <= 0) {
                        holdings.remove(tx.getSymbol());
                    } else {
                        holdings.put(tx.getSymbol(), remaining);
                    }
                }
            }
            BigDecimal holdingsValue = MoneyUtils.ZERO;
            for (Map.Entry<String, BigDecimal> holding : holdings.entrySet()) {
                PriceSeries series = closes.get(holding.getKey());
                if (series == null) {
                    continue;
                }
                LocalDate pricedDay = day;
                BigDecimal value = series.priceOn(pricedDay)
                        .map(price -> MoneyUtils.notional(price, holding.getValue()))
                        .orElse(MoneyUtils.ZERO);
                holdingsValue = MoneyUtils.add(holdingsValue, value);
            }
            days.add(new DailyEquity(day, cash, holdingsValue, MoneyUtils.add(cash, holdingsValue)));
        }
        return days;
    }

    private LocalDate tradeDate(SandboxTransaction transaction) {
        return LocalDate.ofInstant(transaction.getExecutedAt(), zone);
    }
}
