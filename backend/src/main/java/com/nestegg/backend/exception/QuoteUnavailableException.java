package com.nestegg.backend.exception;

public class QuoteUnavailableException extends RuntimeException {

    private final String symbol;

    public QuoteUnavailableException(String symbol) {
        super("Could not fetch current price for " + symbol);
        this.symbol = symbol;
    }

    public QuoteUnavailableException(String symbol, Throwable cause) {
        super("Could not fetch current price for " + symbol, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
