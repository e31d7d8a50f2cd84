package com.nestegg.backend.exception;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Business-rule rejection of a trade. Raised before any ledger mutation.
 */
public class TradingException extends RuntimeException {

    private final String errorCode;
    private final Map<String, BigDecimal> amounts;

    public TradingException(String errorCode, String message) {
        this(errorCode, message, Map.of());
    }

    public TradingException(String errorCode, String message, Map<String, BigDecimal> amounts) {
        super(message);
        this.errorCode = errorCode;
        this.amounts = Collections.unmodifiableMap(new LinkedHashMap<>(amounts));
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, BigDecimal> getAmounts() {
        return amounts;
    }

    static Map<String, BigDecimal> amounts(String k1, BigDecimal v1, String k2, BigDecimal v2, String k3, BigDecimal v3) {
        Map<String, BigDecimal> values = new LinkedHashMap<>();
        values.put(k1, v1);
        values.put(k2, v2);
        values.put(k3, v3);
        return values;
    }
}
