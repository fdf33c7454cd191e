package com.quantinfo.collector.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Entity representing one value of a technical indicator series.
 * A series is identified by (instrument, kind, period) and is rewritten in full on recomputation.
 */
@Entity
@Table(name = "technical_indicators", indexes = {
        @Index(name = "idx_indicator_instrument_kind", columnList = "instrument_id, indicator_type"),
        @Index(name = "idx_indicator_instrument_date", columnList = "instrument_id, indicator_date, indicator_type, period_length")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TechnicalIndicatorPoint {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "instrument_id", nullable = false, updatable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Instrument instrument;

    @Column(name = "indicator_date", nullable = false)
    private LocalDate indicatorDate;

    @Enumerated(EnumType.STRING)
    @Column(name = "indicator_type", nullable = false, length = 20)
    private IndicatorKind kind;

    @Column(name = "period_length")
    private Integer period;

    @Column(name = "indicator_value", nullable = false)
    private Double value;

    // MACD signal line; null for single-line indicators
    @Column(name = "signal_value")
    private Double signalValue;

    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
