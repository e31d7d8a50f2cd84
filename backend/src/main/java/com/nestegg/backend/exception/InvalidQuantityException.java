package com.nestegg.backend.exception;

public class InvalidQuantityException extends TradingException {
    public InvalidQuantityException(String message) {
        super("INVALID_QUANTITY", message);
    }
}
