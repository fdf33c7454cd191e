package com.quantinfo.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing one trading day of OHLCV data for an instrument.
 * At most one bar exists per (instrument, trade date).
 */
@Entity
@Table(name = "price_bars", uniqueConstraints = {
        @UniqueConstraint(name = "uk_price_bar_instrument_date", columnNames = { "instrument_id", "trade_date" })
}, indexes = {
        @Index(name = "idx_price_bar_instrument_date", columnList = "instrument_id, trade_date")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PriceBar {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "instrument_id", nullable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Instrument instrument;

    @Column(name = "trade_date", nullable = false)
    private LocalDate tradeDate;

    @Column(name = "open_price", nullable = false, precision = 14, scale = 4)
    private BigDecimal open;

    @Column(name = "high_price", nullable = false, precision = 14, scale = 4)
    private BigDecimal high;

    @Column(name = "low_price", nullable = false, precision = 14, scale = 4)
    private BigDecimal low;

    @Column(name = "close_price", nullable = false, precision = 14, scale = 4)
    private BigDecimal close;

    @Column(name = "volume", nullable = false)
    private Long volume;

    @Column(name = "adjusted_close", precision = 14, scale = 4)
    private BigDecimal adjustedClose;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
