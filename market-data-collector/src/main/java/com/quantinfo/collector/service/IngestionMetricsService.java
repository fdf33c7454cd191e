package com.quantinfo.collector.service;

import com.quantinfo.collector.domain.RankingDimension;
import com.quantinfo.collector.domain.RefreshOutcome;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.provider.Quote;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Service for tracking ingestion, indicator and ranking metrics.
 * Exposes metrics via Spring Boot Actuator for monitoring.
 */
@Service
@Slf4j
public class IngestionMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter barsInsertedCounter;
    private final Counter barsSkippedCounter;
    private final Counter barsRejectedCounter;
    private final Timer refreshTimer;
    private final Timer batchTimer;
    private final Counter quotesCounter;
    private final Map<String, Double> lastPrices = new ConcurrentHashMap<>();

    public IngestionMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.barsInsertedCounter = Counter.builder("ingestion.bars.inserted")
                .description("Price bars written to storage")
                .register(meterRegistry);

        this.barsSkippedCounter = Counter.builder("ingestion.bars.skipped")
                .description("Fetched price bars already present in storage")
                .register(meterRegistry);

        this.barsRejectedCounter = Counter.builder("ingestion.bars.rejected")
                .description("Fetched price bars failing the OHLC sanity checks")
                .register(meterRegistry);

        this.refreshTimer = Timer.builder("ingestion.refresh.time")
                .description("Single instrument refresh time")
                .register(meterRegistry);

        this.batchTimer = Timer.builder("ingestion.batch.time")
                .description("Batch refresh time")
                .register(meterRegistry);

        this.quotesCounter = Counter.builder("quotes.received")
                .description("Realtime quotes polled from the provider")
                .register(meterRegistry);

        log.info("IngestionMetricsService initialized with Micrometer metrics");
    }

    /**
     * Record the outcome and duration of one instrument refresh.
     */
    public void recordRefresh(RefreshOutcome outcome, long elapsedMs) {
        meterRegistry.counter("ingestion.refresh.outcome", "outcome", outcome.name()).increment();
        refreshTimer.record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    public void recordBars(int inserted, int skipped, int rejected) {
        barsInsertedCounter.increment(inserted);
        barsSkippedCounter.increment(skipped);
        barsRejectedCounter.increment(rejected);
    }

    /**
     * Record a finished batch under the name of the job that ran it.
     */
    public void recordBatch(String job, RefreshTally tally) {
        meterRegistry.counter("ingestion.batch.instruments", "job", job, "result", "success")
                .increment(tally.getSuccess());
        meterRegistry.counter("ingestion.batch.instruments", "job", job, "result", "failed")
                .increment(tally.getFailed());
        batchTimer.record(tally.getElapsed());
    }

    public void recordIndicatorRun(boolean success) {
        meterRegistry.counter("indicators.runs", "result", success ? "success" : "failed").increment();
    }

    public void recordRankingRequest(RankingDimension dimension) {
        meterRegistry.counter("rankings.requests", "dimension", dimension.getPath()).increment();
    }

    /**
     * Record the latest polled price per symbol as a gauge tagged with the symbol.
     */
    public void recordQuotes(Collection<Quote> quotes) {
        for (Quote quote : quotes) {
            if (quote.getSymbol() == null || quote.getPrice() == null) {
                continue;
            }
            String symbol = quote.getSymbol();
            if (lastPrices.put(symbol, quote.getPrice().doubleValue()) == null) {
                Gauge.builder("quotes.last.price", lastPrices, prices -> prices.getOrDefault(symbol, Double.NaN))
                        .description("Latest polled price")
                        .tag("symbol", symbol)
                        .register(meterRegistry);
            }
        }
        quotesCounter.increment(quotes.size());
    }

    public void recordTaskError(String task) {
        meterRegistry.counter("scheduler.task.errors", "task", task).increment();
    }

    /**
     * Get current metrics summary (for logging purposes).
     */
    public String getMetricsSummary() {
        return String.format("Metrics: BarsInserted=%d, BarsSkipped=%d, BarsRejected=%d, Refreshes=%d, AvgRefresh=%.2fs",
                (long) barsInsertedCounter.count(),
                (long) barsSkippedCounter.count(),
                (long) barsRejectedCounter.count(),
                refreshTimer.count(),
                refreshTimer.mean(TimeUnit.SECONDS));
    }
}
