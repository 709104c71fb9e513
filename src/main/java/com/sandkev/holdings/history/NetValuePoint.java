package com.sandkev.holdings.history;

import java.math.BigDecimal;
import java.time.Instant;

public record NetValuePoint(Instant asOf, BigDecimal netUsd) {}
