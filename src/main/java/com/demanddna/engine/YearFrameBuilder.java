package com.demanddna.engine;

import java.time.LocalDate;
import java.time.Year;

public class YearFrameBuilder {

    /**
     * Builds the 365 (or 366) day frame for {@code year} with every index column at zero.
     */
    public YearFrame build(int year) {
        int length = Year.of(year).length();
        LocalDate[] dates = new LocalDate[length];
        LocalDate first = LocalDate.of(year, 1, 1);
        for (int i = 0; i < length; i++) {
            dates[i] = first.plusDays(i);
        }
        return new YearFrame(year, dates);
    }
}
