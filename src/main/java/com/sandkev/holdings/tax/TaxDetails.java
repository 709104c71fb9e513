package com.sandkev.holdings.tax;

import java.math.BigDecimal;

public record TaxDetails(BigDecimal taxFreeAmount, BigDecimal averageBuyValue, PercentChange percentChange) {}
