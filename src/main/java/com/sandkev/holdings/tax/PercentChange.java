package com.sandkev.holdings.tax;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;

/** Change of current price against average buy price, in percent, or "undefined". */
public record PercentChange(@Nullable BigDecimal value) {

    public static final PercentChange UNDEFINED = new PercentChange(null);

    public boolean isDefined() {
        return value != null;
    }

    @JsonValue
    public Object json() {
        return value == null ? "undefined" : value;
    }
}
