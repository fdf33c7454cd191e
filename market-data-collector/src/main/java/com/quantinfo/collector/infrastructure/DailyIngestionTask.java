package com.quantinfo.collector.infrastructure;

import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.service.IngestionMetricsService;
import com.quantinfo.collector.service.IngestionOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Refreshes every active instrument once a day.
 */
@Slf4j
public class DailyIngestionTask extends PeriodicTask {

    private final IngestionOrchestrator orchestrator;
    private final LocalTime runAt;
    private final int lookbackDays;

    public DailyIngestionTask(IngestionOrchestrator orchestrator, IngestionMetricsService metricsService, Clock clock,
            Duration errorBackoff, LocalTime runAt, int lookbackDays) {
        super("daily-ingestion", metricsService, clock, errorBackoff);
        this.orchestrator = orchestrator;
        this.runAt = runAt;
        this.lookbackDays = lookbackDays;
    }

    @Override
    protected ZonedDateTime nextRun(ZonedDateTime now) {
        return nextDailyRun(now, runAt);
    }

    @Override
    protected void runOnce() {
        log.info("Starting daily ingestion with lookback {} days", lookbackDays);
        RefreshTally tally = orchestrator.refreshAll(lookbackDays);
        metricsService.recordBatch(getName(), tally);
        logResult(tally);
        log.info(metricsService.getMetricsSummary());
    }
}
