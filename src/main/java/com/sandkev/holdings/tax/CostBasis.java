package com.sandkev.holdings.tax;

import java.math.BigDecimal;

/** What the accounting side knows about one asset. */
public record CostBasis(BigDecimal taxFreeAmount, BigDecimal averageBuyValue) {}
