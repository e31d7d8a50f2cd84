package com.nestegg.backend.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Daily closes for one symbol with a defined price on every calendar day of a range.
 * Days without a print take the previous close; days before the first print take the
 * first close. A series built from no data at all has no price on any day.
 */
public final class PriceSeries {

    private final LocalDate from;
    private final LocalDate to;
    private final Map<LocalDate, BigDecimal> prices;

    private PriceSeries(LocalDate from, LocalDate to, Map<LocalDate, BigDecimal> prices) {
        this.from = from;
        this.to = to;
        this.prices = Collections.unmodifiableMap(prices);
    }

    public static PriceSeries gapFilled(NavigableMap<LocalDate, BigDecimal> closes, LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before start " + from);
        }
        Map<LocalDate, BigDecimal> filled = new LinkedHashMap<>();
        if (closes == null || closes.isEmpty()) {
            return new PriceSeries(from, to, filled);
        }
        // Seed with the last print at or before the range start, else the first print overall
        Map.Entry<LocalDate, BigDecimal> floor = closes.floorEntry(from);
        BigDecimal carry = floor != null ? floor.getValue() : closes.firstEntry().getValue();
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            BigDecimal close = closes.get(day);
            if (close != null) {
                carry = close;
            }
            filled.put(day, carry);
        }
        return new PriceSeries(from, to, filled);
    }

    public Optional<BigDecimal> priceOn(LocalDate day) {
        return Optional.ofNullable(prices.get(day));
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    public LocalDate getFrom() {
        return from;
    }

    public LocalDate getTo() {
        return to;
    }

    public boolean covers(LocalDate start, LocalDate end) {
        return !start.isBefore(from) && !end.isAfter(to);
    }
}
