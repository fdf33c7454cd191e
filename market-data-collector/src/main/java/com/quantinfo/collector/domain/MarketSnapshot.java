package com.quantinfo.collector.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Latest price bar of an instrument joined with its descriptive fields, as ranked.
 */
@Value
@Builder
public class MarketSnapshot {

    String symbol;
    String name;
    String sector;
    Double marketCap;
    LocalDate tradeDate;
    double open;
    double high;
    double low;
    double close;
    long volume;

    public static MarketSnapshot of(PriceBar bar) {
        Instrument instrument = bar.getInstrument();
        return MarketSnapshot.builder()
                .symbol(instrument.getSymbol())
                .name(instrument.getName())
                .sector(instrument.getSector())
                .marketCap(instrument.getMarketCap())
                .tradeDate(bar.getTradeDate())
                .open(bar.getOpen().doubleValue())
                .high(bar.getHigh().doubleValue())
                .low(bar.getLow().doubleValue())
                .close(bar.getClose().doubleValue())
                .volume(bar.getVolume())
                .build();
    }

    public double turnover() {
        return volume * close;
    }

    public double volatilityPercent() {
        return (high - low) / close * 100;
    }

    public double percentChange() {
        return (close - open) / open * 100;
    }
}
