package com.schoolbav.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Rounding {
    private Rounding() {
    }

    /** Half-up decimal rounding, as SQL ROUND(x, scale) does for the stored metrics. */
    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) return value;
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static Double round(Double value, int scale) {
        return value == null ? null : round(value.doubleValue(), scale);
    }
}
