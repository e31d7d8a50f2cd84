package com.nestegg.backend.service;

import java.math.BigDecimal;
import java.time.LocalDate;

public record DailyEquity(LocalDate date, BigDecimal cash, BigDecimal holdingsValue, BigDecimal totalEquity) {
}
