package com.quantinfo.collector.infrastructure;

import com.quantinfo.collector.provider.Quote;
import com.quantinfo.collector.service.IngestionMetricsService;
import com.quantinfo.collector.service.IngestionOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Polls realtime quotes of the active universe while the market is open and publishes the
 * latest price per symbol as a gauge. Each tick starts where the previous one stopped, so a
 * provider that caps the batch size still cycles through the whole universe.
 * Outside the trading window it only wakes up at the off-hours cadence to re-check.
 */
@Slf4j
public class IntradayQuoteTask extends PeriodicTask {

    private final IngestionOrchestrator orchestrator;
    private final TradingWindow tradingWindow;
    private final Duration interval;
    private final Duration offHoursInterval;

    private volatile ZonedDateTime lastRun;
    private volatile int cursor;

    public IntradayQuoteTask(IngestionOrchestrator orchestrator, IngestionMetricsService metricsService, Clock clock,
            Duration errorBackoff, TradingWindow tradingWindow, Duration interval, Duration offHoursInterval) {
        super("intraday-quotes", metricsService, clock, errorBackoff);
        this.orchestrator = orchestrator;
        this.tradingWindow = tradingWindow;
        this.interval = interval;
        this.offHoursInterval = offHoursInterval;
    }

    @Override
    protected ZonedDateTime nextRun(ZonedDateTime now) {
        if (lastRun == null) {
            return now;
        }
        return lastRun.plus(tradingWindow.isOpen(lastRun) ? interval : offHoursInterval);
    }

    @Override
    protected void runOnce() throws InterruptedException {
        ZonedDateTime now = now();
        lastRun = now;
        if (!tradingWindow.isOpen(now)) {
            log.debug("Market closed at {}, next check in {}", now, offHoursInterval);
            return;
        }
        List<Long> ids = orchestrator.activeInstrumentIds();
        if (ids.isEmpty()) {
            cursor = 0;
            return;
        }
        int start = cursor % ids.size();
        List<Long> ordered = new ArrayList<>(ids.subList(start, ids.size()));
        ordered.addAll(ids.subList(0, start));

        Map<Long, Quote> quotes = orchestrator.fetchRealtimeQuotes(ordered);
        metricsService.recordQuotes(quotes.values());
        cursor = (start + Math.max(quotes.size(), 1)) % ids.size();
        log.info("task={} instruments={} quotes={} next-start={}", getName(), ids.size(), quotes.size(), cursor);
    }

    @Override
    void reset() {
        super.reset();
        lastRun = null;
        cursor = 0;
    }
}
