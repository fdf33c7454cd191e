package com.quantinfo.collector.infrastructure;

import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.service.IngestionMetricsService;
import com.quantinfo.collector.service.IngestionOrchestrator;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Recomputes the indicator series of every active instrument after the close.
 */
public class IndicatorRecomputeTask extends PeriodicTask {

    private final IngestionOrchestrator orchestrator;
    private final LocalTime runAt;

    public IndicatorRecomputeTask(IngestionOrchestrator orchestrator, IngestionMetricsService metricsService,
            Clock clock, Duration errorBackoff, LocalTime runAt) {
        super("indicator-recompute", metricsService, clock, errorBackoff);
        this.orchestrator = orchestrator;
        this.runAt = runAt;
    }

    @Override
    protected ZonedDateTime nextRun(ZonedDateTime now) {
        return nextDailyRun(now, runAt);
    }

    @Override
    protected void runOnce() {
        RefreshTally tally = orchestrator.recomputeIndicators(IndicatorKind.defaults());
        metricsService.recordBatch(getName(), tally);
        logResult(tally);
    }
}
