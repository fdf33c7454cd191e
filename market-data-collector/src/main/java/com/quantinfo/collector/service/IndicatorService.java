package com.quantinfo.collector.service;

import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.Instrument;
import com.quantinfo.collector.domain.PriceBar;
import com.quantinfo.collector.domain.TechnicalIndicatorPoint;
import com.quantinfo.collector.domain.TechnicalIndicators;
import com.quantinfo.collector.repository.InstrumentRepository;
import com.quantinfo.collector.repository.PriceBarRepository;
import com.quantinfo.collector.repository.TechnicalIndicatorRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Service that derives indicator series from stored price history.
 * Each recomputation replaces the prior series of the requested kinds in full.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IndicatorService {

    static final int HISTORY_WINDOW = 100;
    static final int MIN_BARS = 20;
    static final int[] MA_PERIODS = { 5, 10, 20, 50 };
    static final int[] EMA_PERIODS = { TechnicalIndicators.MACD_FAST, TechnicalIndicators.MACD_SLOW };

    private final InstrumentRepository instrumentRepository;
    private final PriceBarRepository priceBarRepository;
    private final TechnicalIndicatorRepository indicatorRepository;
    private final IngestionMetricsService metricsService;

    /**
     * Recompute the requested indicator kinds over the most recent bars of an instrument.
     *
     * @return number of points written per kind
     * @throws InstrumentNotFoundException   if the instrument does not exist
     * @throws InsufficientHistoryException if fewer than 20 bars are stored; nothing is written
     */
    @Transactional
    public Map<IndicatorKind, Integer> computeIndicators(Long instrumentId, Collection<IndicatorKind> kinds) {
        Instrument instrument = instrumentRepository.findById(instrumentId)
                .orElseThrow(() -> new InstrumentNotFoundException(instrumentId));

        List<PriceBar> bars = new ArrayList<>(
                priceBarRepository.findRecentBars(instrumentId, PageRequest.of(0, HISTORY_WINDOW)));
        if (bars.size() < MIN_BARS) {
            metricsService.recordIndicatorRun(false);
            throw new InsufficientHistoryException(instrument.getSymbol(), bars.size(), MIN_BARS);
        }
        bars.sort(Comparator.comparing(PriceBar::getTradeDate));

        List<LocalDate> dates = new ArrayList<>(bars.size());
        List<Double> closes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            dates.add(bar.getTradeDate());
            closes.add(bar.getClose().doubleValue());
        }

        Map<IndicatorKind, Integer> written = new EnumMap<>(IndicatorKind.class);
        for (IndicatorKind kind : kinds) {
            int deleted = indicatorRepository.deleteByInstrumentAndKind(instrumentId, kind);
            List<TechnicalIndicatorPoint> points = buildSeries(instrument, kind, dates, closes);
            indicatorRepository.saveAll(points);
            written.put(kind, points.size());
            log.debug("Replaced {} {} points of {} with {}", deleted, kind, instrument.getSymbol(), points.size());
        }

        metricsService.recordIndicatorRun(true);
        log.info("Computed indicators {} for {} over {} bars", written, instrument.getSymbol(), bars.size());
        return written;
    }

    /**
     * Stored series of one indicator, oldest first. A null period returns every period of the kind.
     */
    @Transactional(readOnly = true)
    public List<TechnicalIndicatorPoint> getIndicatorSeries(Long instrumentId, IndicatorKind kind, Integer period) {
        if (!instrumentRepository.existsById(instrumentId)) {
            throw new InstrumentNotFoundException(instrumentId);
        }
        if (period == null) {
            return indicatorRepository.findByInstrumentIdAndKindOrderByIndicatorDateAsc(instrumentId, kind);
        }
        return indicatorRepository.findByInstrumentIdAndKindAndPeriodOrderByIndicatorDateAsc(instrumentId, kind,
                period);
    }

    private List<TechnicalIndicatorPoint> buildSeries(Instrument instrument, IndicatorKind kind,
            List<LocalDate> dates, List<Double> closes) {
        List<TechnicalIndicatorPoint> points = new ArrayList<>();
        switch (kind) {
            case MA:
                for (int period : MA_PERIODS) {
                    if (period <= closes.size()) {
                        addPoints(points, instrument, kind, period, dates,
                                TechnicalIndicators.movingAverage(closes, period), null);
                    }
                }
                break;
            case EMA:
                for (int period : EMA_PERIODS) {
                    if (period <= closes.size()) {
                        addPoints(points, instrument, kind, period, dates,
                                TechnicalIndicators.ema(closes, period), null);
                    }
                }
                break;
            case RSI:
                addPoints(points, instrument, kind, TechnicalIndicators.RSI_PERIOD, dates,
                        TechnicalIndicators.rsi(closes, TechnicalIndicators.RSI_PERIOD), null);
                break;
            case MACD:
                TechnicalIndicators.Macd macd = TechnicalIndicators.macd(closes);
                addPoints(points, instrument, kind, TechnicalIndicators.MACD_FAST, dates, macd.getLine(),
                        macd.getSignal());
                break;
            default:
                throw new IllegalArgumentException("Unsupported indicator kind: " + kind);
        }
        return points;
    }

    private static void addPoints(List<TechnicalIndicatorPoint> points, Instrument instrument, IndicatorKind kind,
            int period, List<LocalDate> dates, List<Double> values, List<Double> signals) {
        for (int i = 0; i < values.size(); i++) {
            Double value = values.get(i);
            if (value == null) {
                continue;
            }
            points.add(TechnicalIndicatorPoint.builder()
                    .instrument(instrument)
                    .indicatorDate(dates.get(i))
                    .kind(kind)
                    .period(period)
                    .value(value)
                    .signalValue(signals == null ? null : signals.get(i))
                    .build());
        }
    }
}
