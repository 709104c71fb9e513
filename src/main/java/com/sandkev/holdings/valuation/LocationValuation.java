package com.sandkev.holdings.valuation;

import java.math.BigDecimal;

public record LocationValuation(BigDecimal usdValue, BigDecimal percentageOfNetValue) {}
