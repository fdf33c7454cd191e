package com.quantinfo.collector.service;

import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.Instrument;
import com.quantinfo.collector.domain.PriceBar;
import com.quantinfo.collector.domain.RefreshOutcome;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.provider.DataProvider;
import com.quantinfo.collector.provider.HistoricalBar;
import com.quantinfo.collector.provider.InstrumentProfile;
import com.quantinfo.collector.provider.Quote;
import com.quantinfo.collector.repository.InstrumentRepository;
import com.quantinfo.collector.repository.PriceBarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Implementation of IngestionOrchestrator.
 * Batch work is fanned out on the fixed ingestion pool, so at most its size of instruments
 * are processed concurrently; the provider's gate further serializes the vendor calls.
 * Refreshes of the same instrument never overlap: a second caller waits for the first and then
 * only fetches what is still missing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionOrchestratorImpl implements IngestionOrchestrator {

    private static final String MDC_SYMBOL = "symbol";

    private final InstrumentRepository instrumentRepository;
    private final PriceBarRepository priceBarRepository;
    private final PriceBarIngestionService priceBarIngestionService;
    private final IndicatorService indicatorService;
    private final DataProvider dataProvider;
    private final IngestionMetricsService metricsService;
    private final Clock clock;

    @Qualifier("ingestionExecutorService")
    private final ExecutorService ingestionExecutor;

    @Qualifier("taskExecutor")
    private final Executor taskExecutor;

    private final ConcurrentMap<Long, ReentrantLock> refreshLocks = new ConcurrentHashMap<>();

    @Value("${market-data.ingestion.enrich-profiles:true}")
    private boolean enrichProfiles = true;

    @Override
    public RefreshOutcome refreshOne(Long instrumentId, int lookbackDays) {
        long startTime = System.currentTimeMillis();
        RefreshOutcome outcome = doRefresh(instrumentId, lookbackDays);
        metricsService.recordRefresh(outcome, System.currentTimeMillis() - startTime);
        return outcome;
    }

    private RefreshOutcome doRefresh(Long instrumentId, int lookbackDays) {
        Optional<Instrument> found = instrumentRepository.findById(instrumentId);
        if (found.isEmpty()) {
            log.warn("Instrument {} not found", instrumentId);
            return RefreshOutcome.NOT_FOUND;
        }
        Instrument instrument = found.get();
        String previousSymbol = MDC.get(MDC_SYMBOL);
        MDC.put(MDC_SYMBOL, instrument.getSymbol());
        try {
            if (!instrument.isActive()) {
                log.info("Skipping inactive instrument {}", instrument.getSymbol());
                return RefreshOutcome.INACTIVE;
            }

            // one refresh per instrument at a time, so a waiter sees the bars the holder stored
            ReentrantLock lock = refreshLocks.computeIfAbsent(instrumentId, id -> new ReentrantLock());
            lock.lockInterruptibly();
            try {
                return fetchAndStore(instrumentId, instrument, lookbackDays);
            } finally {
                lock.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Refresh of {} interrupted", instrument.getSymbol());
            return RefreshOutcome.FAILED;
        } catch (DataIntegrityViolationException e) {
            log.error("Concurrent write conflict while refreshing {}: {}", instrument.getSymbol(), e.getMessage());
            return RefreshOutcome.FAILED;
        } catch (Exception e) {
            log.error("Refresh of {} failed", instrument.getSymbol(), e);
            return RefreshOutcome.FAILED;
        } finally {
            if (previousSymbol == null) {
                MDC.remove(MDC_SYMBOL);
            } else {
                MDC.put(MDC_SYMBOL, previousSymbol);
            }
        }
    }

    private RefreshOutcome fetchAndStore(Long instrumentId, Instrument instrument, int lookbackDays)
            throws InterruptedException {
        LocalDate today = LocalDate.now(clock);
        LocalDate start = today.minusDays(lookbackDays);
        Optional<PriceBar> lastBar = priceBarRepository.findTopByInstrumentIdOrderByTradeDateDesc(instrumentId);
        if (lastBar.isPresent()) {
            LocalDate nextMissing = lastBar.get().getTradeDate().plusDays(1);
            if (nextMissing.isAfter(start)) {
                start = nextMissing;
            }
        }
        if (start.isAfter(today)) {
            log.debug("{} already current through {}", instrument.getSymbol(), today);
            return RefreshOutcome.ALREADY_CURRENT;
        }

        List<HistoricalBar> bars = dataProvider.fetchHistory(instrument.getSymbol(), start, today);
        if (bars.isEmpty()) {
            log.warn("No data from {} for {} between {} and {}", dataProvider.getName(),
                    instrument.getSymbol(), start, today);
            return RefreshOutcome.NO_DATA;
        }
        if (Thread.currentThread().isInterrupted()) {
            log.warn("Refresh of {} cancelled before persisting", instrument.getSymbol());
            return RefreshOutcome.FAILED;
        }

        int inserted = priceBarIngestionService.ingest(instrumentId, bars);
        log.info("Updated {}: {} new bars from {} fetched", instrument.getSymbol(), inserted, bars.size());

        if (enrichProfiles && (instrument.getSector() == null || instrument.getMarketCap() == null)) {
            enrichProfile(instrumentId);
        }
        return RefreshOutcome.UPDATED;
    }

    @Override
    public RefreshTally refreshAll(int lookbackDays) {
        List<Long> ids = activeInstrumentIds();
        log.info("Refreshing {} active instruments with lookback {} days", ids.size(), lookbackDays);
        RefreshTally tally = refreshInstruments(ids, lookbackDays);
        log.info("Refresh of all active instruments finished: total={}, success={}, failed={}",
                tally.getTotal(), tally.getSuccess(), tally.getFailed());
        return tally;
    }

    @Override
    public RefreshTally refreshInstruments(Collection<Long> instrumentIds, int lookbackDays) {
        return runBatch(instrumentIds, id -> refreshOne(id, lookbackDays));
    }

    @Override
    public CompletableFuture<RefreshTally> submitRefresh(Collection<Long> instrumentIds, int lookbackDays) {
        boolean all = instrumentIds == null || instrumentIds.isEmpty();
        log.info("Manual refresh requested for {} instruments, lookback {} days",
                all ? "all" : String.valueOf(instrumentIds.size()), lookbackDays);
        List<Long> ids = all ? null : new ArrayList<>(instrumentIds);
        return CompletableFuture.supplyAsync(() -> {
            RefreshTally tally = all ? refreshAll(lookbackDays) : refreshInstruments(ids, lookbackDays);
            metricsService.recordBatch("manual", tally);
            return tally;
        }, taskExecutor);
    }

    @Override
    public Map<Long, Quote> fetchRealtimeQuotes(Collection<Long> instrumentIds) throws InterruptedException {
        Map<String, Long> idsBySymbol = new LinkedHashMap<>();
        for (Instrument instrument : instrumentRepository.findAllById(instrumentIds)) {
            if (instrument.isActive()) {
                idsBySymbol.put(instrument.getSymbol(), instrument.getId());
            }
        }
        if (idsBySymbol.isEmpty()) {
            return Collections.emptyMap();
        }

        Map<String, Quote> quotes = dataProvider.fetchRealtimeBatch(idsBySymbol.keySet());
        Map<Long, Quote> result = new LinkedHashMap<>();
        quotes.forEach((symbol, quote) -> {
            Long id = idsBySymbol.get(symbol);
            if (id != null) {
                result.put(id, quote);
            }
        });
        log.info("Fetched {} realtime quotes for {} instruments", result.size(), idsBySymbol.size());
        return result;
    }

    @Override
    public List<InstrumentProfile> searchInstruments(String query, int limit) throws InterruptedException {
        if (query == null || query.isBlank() || limit <= 0) {
            return Collections.emptyList();
        }
        List<InstrumentProfile> candidates = dataProvider.search(query.trim());
        List<InstrumentProfile> limited = candidates.subList(0,
                Math.min(Math.min(limit, DataProvider.MAX_SEARCH_RESULTS), candidates.size()));

        Set<String> symbols = limited.stream().map(InstrumentProfile::getSymbol).collect(Collectors.toSet());
        Set<String> stored = instrumentRepository.findBySymbolIn(symbols).stream()
                .map(Instrument::getSymbol)
                .collect(Collectors.toSet());

        List<InstrumentProfile> results = new ArrayList<>(limited.size());
        for (InstrumentProfile candidate : limited) {
            results.add(candidate.toBuilder().existsInUniverse(stored.contains(candidate.getSymbol())).build());
        }
        return results;
    }

    @Override
    public boolean enrichProfile(Long instrumentId) throws InterruptedException {
        Instrument instrument = instrumentRepository.findById(instrumentId)
                .orElseThrow(() -> new InstrumentNotFoundException(instrumentId));
        Optional<InstrumentProfile> profile = dataProvider.getProfile(instrument.getSymbol());
        if (profile.isEmpty()) {
            log.debug("No profile available for {}", instrument.getSymbol());
            return false;
        }

        InstrumentProfile p = profile.get();
        boolean changed = false;
        if (p.getName() != null && !p.getName().equals(instrument.getName())) {
            instrument.setName(p.getName());
            changed = true;
        }
        if (p.getExchange() != null && !p.getExchange().equals(instrument.getExchange())) {
            instrument.setExchange(p.getExchange());
            changed = true;
        }
        if (p.getSector() != null && !p.getSector().equals(instrument.getSector())) {
            instrument.setSector(p.getSector());
            changed = true;
        }
        if (p.getIndustry() != null && !p.getIndustry().equals(instrument.getIndustry())) {
            instrument.setIndustry(p.getIndustry());
            changed = true;
        }
        if (p.getMarketCap() != null && !p.getMarketCap().equals(instrument.getMarketCap())) {
            instrument.setMarketCap(p.getMarketCap());
            changed = true;
        }
        if (changed) {
            instrumentRepository.save(instrument);
            log.info("Enriched profile of {}", instrument.getSymbol());
        }
        return changed;
    }

    @Override
    public List<Long> activeInstrumentIds() {
        return instrumentRepository.findActiveIds();
    }

    @Override
    public RefreshTally recomputeIndicators(Collection<IndicatorKind> kinds) {
        List<Long> ids = activeInstrumentIds();
        log.info("Recomputing indicators {} for {} active instruments", kinds, ids.size());
        return runBatch(ids, id -> {
            try {
                indicatorService.computeIndicators(id, kinds);
                return RefreshOutcome.UPDATED;
            } catch (InsufficientHistoryException e) {
                log.warn(e.getMessage());
                return RefreshOutcome.NO_DATA;
            } catch (InstrumentNotFoundException e) {
                return RefreshOutcome.NOT_FOUND;
            } catch (Exception e) {
                log.error("Indicator recomputation failed for instrument {}", id, e);
                return RefreshOutcome.FAILED;
            }
        });
    }

    /**
     * Run one operation per instrument on the ingestion pool and fold the outcomes.
     * If the calling thread is interrupted, outstanding work is cancelled and counted as failed.
     */
    private RefreshTally runBatch(Collection<Long> instrumentIds, Function<Long, RefreshOutcome> operation) {
        long startTime = System.currentTimeMillis();
        List<Long> ids = new ArrayList<>(new LinkedHashSet<>(instrumentIds));
        Map<Long, String> labels = labels(ids);

        List<Future<RefreshOutcome>> futures = new ArrayList<>(ids.size());
        for (Long id : ids) {
            futures.add(ingestionExecutor.submit(() -> operation.apply(id)));
        }

        RefreshTally tally = RefreshTally.empty();
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            String label = labels.get(ids.get(i));
            Future<RefreshOutcome> future = futures.get(i);
            if (interrupted) {
                future.cancel(true);
                tally = tally.merge(RefreshTally.of(label, RefreshOutcome.FAILED));
                continue;
            }
            try {
                tally = tally.merge(RefreshTally.of(label, future.get()));
            } catch (InterruptedException e) {
                interrupted = true;
                future.cancel(true);
                tally = tally.merge(RefreshTally.of(label, RefreshOutcome.FAILED));
            } catch (ExecutionException e) {
                log.error("Task for {} failed", label, e.getCause());
                tally = tally.merge(RefreshTally.of(label, RefreshOutcome.FAILED));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
            log.warn("Batch interrupted; outstanding instruments cancelled");
        }
        return tally.withElapsed(Duration.ofMillis(System.currentTimeMillis() - startTime));
    }

    private Map<Long, String> labels(List<Long> ids) {
        Map<Long, String> labels = new HashMap<>();
        for (Instrument instrument : instrumentRepository.findAllById(ids)) {
            labels.put(instrument.getId(), instrument.getSymbol());
        }
        for (Long id : ids) {
            labels.putIfAbsent(id, "#" + id);
        }
        return labels;
    }
}
