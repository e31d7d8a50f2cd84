package com.nestegg.backend.exception;

public class MarketDataRateLimitException extends MarketDataException {
    public MarketDataRateLimitException(String message) {
        super(message, 429, null);
    }
}
