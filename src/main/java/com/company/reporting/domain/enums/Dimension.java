package com.company.reporting.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Aggregation axes a summary can be broken down by.
 */
public enum Dimension {
    DAY,
    MONTH,
    WEEKDAY,
    TABLE,
    USER;

    public static Set<Dimension> all() {
        return EnumSet.allOf(Dimension.class);
    }

    /** Totals only: no breakdown map is filled. */
    public static Set<Dimension> none() {
        return EnumSet.noneOf(Dimension.class);
    }
}
