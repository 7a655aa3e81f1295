package com.samplesift.date;

import java.util.Locale;

/** Date components in significance order; a component is only known if every earlier one is. */
public enum DateComponent {
    YEAR,
    MONTH,
    DAY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
