package com.nestegg.backend.model;

public enum TradeSide {
    BUY,
    SELL
}
