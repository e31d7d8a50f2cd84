package com.nestegg.backend.exception;

import java.math.BigDecimal;

public class InsufficientSharesException extends TradingException {

    private final BigDecimal shortfall;

    public InsufficientSharesException(String symbol, BigDecimal requested, BigDecimal owned) {
        super("INSUFFICIENT_SHARES",
                String.format("Insufficient shares of %s (%s < %s)", symbol, owned.toPlainString(), requested.toPlainString()),
                amounts("requested", requested, "owned", owned, "shortfall", requested.subtract(owned)));
        this.shortfall = requested.subtract(owned);
    }

    public BigDecimal getShortfall() {
        return shortfall;
    }
}
