package com.nestegg.backend.exception;

import java.math.BigDecimal;

public class InsufficientFundsException extends TradingException {

    private final BigDecimal shortfall;

    public InsufficientFundsException(BigDecimal required, BigDecimal available) {
        super("INSUFFICIENT_FUNDS",
                String.format("Insufficient funds (%s < %s)", available.toPlainString(), required.toPlainString()),
                amounts("required", required, "available", available, "shortfall", required.subtract(available)));
        this.shortfall = required.subtract(available);
    }

    public BigDecimal getShortfall() {
        return shortfall;
    }
}
