package com.quantinfo.collector.service;

import com.quantinfo.collector.domain.Instrument;
import com.quantinfo.collector.domain.PriceBar;
import com.quantinfo.collector.domain.PriceBarValidator;
import com.quantinfo.collector.provider.HistoricalBar;
import com.quantinfo.collector.repository.InstrumentRepository;
import com.quantinfo.collector.repository.PriceBarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Service for merging fetched bars into the price history of an instrument.
 * Bars whose trade date is already stored are skipped, so repeated ingestion of the
 * same window is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PriceBarIngestionService {

    static final int BATCH_SIZE = 1000;

    private final InstrumentRepository instrumentRepository;
    private final PriceBarRepository priceBarRepository;
    private final IngestionMetricsService metricsService;

    /**
     * Persist the bars not yet stored for an instrument, in one transaction.
     *
     * @param instrumentId the owning instrument
     * @param bars         fetched bars, any order
     * @return number of bars inserted
     */
    @Transactional
    public int ingest(Long instrumentId, List<HistoricalBar> bars) {
        if (bars.isEmpty()) {
            return 0;
        }
        Instrument instrument = instrumentRepository.findById(instrumentId)
                .orElseThrow(() -> new InstrumentNotFoundException(instrumentId));

        LocalDate first = bars.stream().map(HistoricalBar::getDate).min(Comparator.naturalOrder()).orElseThrow();
        LocalDate last = bars.stream().map(HistoricalBar::getDate).max(Comparator.naturalOrder()).orElseThrow();
        Set<LocalDate> stored = new HashSet<>(priceBarRepository.findTradeDates(instrumentId, first, last));

        List<PriceBar> toInsert = new ArrayList<>();
        int inserted = 0;
        int skipped = 0;
        int rejected = 0;

        for (HistoricalBar bar : bars) {
            if (bar.getDate() == null || stored.contains(bar.getDate())) {
                skipped++;
                continue;
            }
            PriceBar priceBar = PriceBar.builder()
                    .instrument(instrument)
                    .tradeDate(bar.getDate())
                    .open(bar.getOpen())
                    .high(bar.getHigh())
                    .low(bar.getLow())
                    .close(bar.getClose())
                    .volume(bar.getVolume())
                    .adjustedClose(bar.getAdjustedClose())
                    .build();
            if (!PriceBarValidator.isValid(priceBar)) {
                rejected++;
                continue;
            }
            // only a stored bar claims its date, so a later valid bar for a rejected date still lands
            stored.add(bar.getDate());
            toInsert.add(priceBar);

            // Batch insert every 1000 records for efficiency
            if (toInsert.size() >= BATCH_SIZE) {
                priceBarRepository.saveAll(toInsert);
                inserted += toInsert.size();
                log.info("Batch inserted {} bars for {}", toInsert.size(), instrument.getSymbol());
                toInsert.clear();
            }
        }

        if (!toInsert.isEmpty()) {
            priceBarRepository.saveAll(toInsert);
            inserted += toInsert.size();
        }

        metricsService.recordBars(inserted, skipped, rejected);
        log.info("Ingested {} bars for {} ({} already stored, {} rejected)", inserted, instrument.getSymbol(),
                skipped, rejected);
        return inserted;
    }
}
