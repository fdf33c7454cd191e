package com.quantinfo.collector.provider;

import com.quantinfo.collector.domain.PriceBarValidator;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * One daily bar as returned by a provider, before it is attached to an instrument.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoricalBar {

    private LocalDate date;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private Long volume;
    private BigDecimal adjustedClose;

    public boolean isValid() {
        return PriceBarValidator.isValid(open, high, low, close, volume);
    }
}
