package com.quantinfo.collector.infrastructure;

import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.service.IngestionMetricsService;
import com.quantinfo.collector.service.IngestionOrchestrator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for MarketDataScheduler lifecycle.
 */
@ExtendWith(MockitoExtension.class)
class MarketDataSchedulerTest {

    @Mock
    private IngestionOrchestrator orchestrator;

    @Mock
    private IngestionMetricsService metricsService;

    private MarketDataScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.stop();
        }
    }

    @Test
    void testStartStop_TasksRunUntilStopped() {
        // Arrange - run times far away so the tasks stay asleep
        scheduler = new MarketDataScheduler(List.of(dailyTask(), indicatorTask()), false);

        // Act
        scheduler.start();
        boolean runningAfterStart = scheduler.isRunning();
        scheduler.stop();

        // Assert
        assertTrue(runningAfterStart);
        assertFalse(scheduler.isRunning());
        verifyNoInteractions(orchestrator);
    }

    @Test
    void testStart_Twice_NoOp() {
        scheduler = new MarketDataScheduler(List.of(dailyTask()), false);

        scheduler.start();
        scheduler.start();

        assertTrue(scheduler.isRunning());
    }

    @Test
    void testStart_AfterStop_Restartable() {
        scheduler = new MarketDataScheduler(List.of(dailyTask()), false);
        scheduler.start();
        scheduler.stop();

        scheduler.start();

        assertTrue(scheduler.isRunning());
    }

    @Test
    void testOnApplicationReady_AutoStartDisabled_StaysStopped() {
        scheduler = new MarketDataScheduler(List.of(dailyTask()), false);

        scheduler.onApplicationReady();

        assertFalse(scheduler.isRunning());
    }

    @Test
    void testGetTaskNames_ListsTasksInOrder() {
        scheduler = new MarketDataScheduler(List.of(dailyTask(), indicatorTask()), true);

        assertEquals(List.of("daily-ingestion", "indicator-recompute"), scheduler.getTaskNames());
    }

    @Test
    void testDailyIngestionTask_RunOnce_RefreshesAllAndRecordsBatch() {
        RefreshTally tally = RefreshTally.empty();
        when(orchestrator.refreshAll(anyInt())).thenReturn(tally);

        dailyTask().runOnce();

        verify(orchestrator).refreshAll(30);
        verify(metricsService).recordBatch("daily-ingestion", tally);
    }

    @Test
    void testIndicatorRecomputeTask_RunOnce_RecomputesDefaultKinds() {
        RefreshTally tally = RefreshTally.empty();
        when(orchestrator.recomputeIndicators(IndicatorKind.defaults())).thenReturn(tally);

        indicatorTask().runOnce();

        verify(metricsService).recordBatch("indicator-recompute", tally);
    }

    private DailyIngestionTask dailyTask() {
        return new DailyIngestionTask(orchestrator, metricsService, Clock.system(ZoneId.of("UTC")),
                Duration.ofMinutes(1), LocalTime.now(ZoneId.of("UTC")).minusMinutes(1), 30);
    }

    private IndicatorRecomputeTask indicatorTask() {
        return new IndicatorRecomputeTask(orchestrator, metricsService, Clock.system(ZoneId.of("UTC")),
                Duration.ofMinutes(1), LocalTime.now(ZoneId.of("UTC")).minusMinutes(1));
    }
}
