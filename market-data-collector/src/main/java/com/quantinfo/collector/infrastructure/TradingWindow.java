package com.quantinfo.collector.infrastructure;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Regular trading session: weekdays between the open and close time, both inclusive,
 * evaluated in the zone of the given timestamp.
 */
public class TradingWindow {

    private final Set<DayOfWeek> tradingDays;
    private final LocalTime open;
    private final LocalTime close;

    public TradingWindow(Set<DayOfWeek> tradingDays, LocalTime open, LocalTime close) {
        this.tradingDays = EnumSet.copyOf(tradingDays);
        this.open = open;
        this.close = close;
    }

    /**
     * Monday to Friday, 09:30 to 16:00.
     */
    public static TradingWindow usEquities() {
        return new TradingWindow(EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY),
                LocalTime.of(9, 30), LocalTime.of(16, 0));
    }

    public boolean isOpen(ZonedDateTime time) {
        if (!tradingDays.contains(time.getDayOfWeek())) {
            return false;
        }
        LocalTime local = time.toLocalTime();
        return !local.isBefore(open) && !local.isAfter(close);
    }
}
