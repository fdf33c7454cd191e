package com.quantinfo.collector.controller;

import com.quantinfo.collector.controller.dto.ErrorResponse;
import com.quantinfo.collector.controller.dto.IndicatorPointResponse;
import com.quantinfo.collector.controller.dto.IndicatorRequest;
import com.quantinfo.collector.controller.dto.IndicatorResponse;
import com.quantinfo.collector.controller.dto.InstrumentRefreshResponse;
import com.quantinfo.collector.controller.dto.RefreshRequest;
import com.quantinfo.collector.controller.dto.RefreshResponse;
import com.quantinfo.collector.controller.dto.SchedulerStatusResponse;
import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.RefreshOutcome;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.infrastructure.MarketDataScheduler;
import com.quantinfo.collector.service.IndicatorService;
import com.quantinfo.collector.service.IngestionOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * REST controller for manual data maintenance and scheduler control.
 */
@RestController
@RequestMapping("/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final IngestionOrchestrator orchestrator;
    private final IndicatorService indicatorService;
    private final MarketDataScheduler scheduler;

    @Value("${market-data.ingestion.manual-lookback-days:30}")
    private int defaultLookbackDays = 30;

    @Value("${admin.refresh-timeout:10m}")
    private Duration refreshTimeout = Duration.ofMinutes(10);

    /**
     * Refresh the given instruments, or all active ones, and wait for the tally.
     *
     * @return 200 with the tally, 504 if it does not finish within the refresh timeout
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh(@Valid @RequestBody(required = false) RefreshRequest request) {
        List<Long> ids = request == null ? null : request.getInstrumentIds();
        int days = request == null || request.getDays() == null ? defaultLookbackDays : request.getDays();

        log.info("POST /admin/refresh - Instruments: {}, Days: {}", ids == null ? "all" : ids.size(), days);

        CompletableFuture<RefreshTally> future = orchestrator.submitRefresh(ids, days);
        try {
            RefreshTally tally = future.get(refreshTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return ResponseEntity.ok(RefreshResponse.from(tally));
        } catch (TimeoutException e) {
            log.warn("Manual refresh did not finish within {}, leaving it running", refreshTimeout);
            future.whenComplete((tally, error) -> {
                if (error != null) {
                    log.error("Timed-out manual refresh failed", error);
                } else {
                    log.info("Timed-out manual refresh finished: total={}, success={}, failed={}",
                            tally.getTotal(), tally.getSuccess(), tally.getFailed());
                }
            });
            return error(HttpStatus.GATEWAY_TIMEOUT, "Refresh did not finish within " + refreshTimeout);
        } catch (ExecutionException e) {
            log.error("Manual refresh failed", e.getCause());
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Refresh failed: " + e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return error(HttpStatus.INTERNAL_SERVER_ERROR, "Refresh interrupted");
        }
    }

    /**
     * Refresh a single instrument synchronously.
     */
    @PostMapping("/instruments/{id}/refresh")
    public ResponseEntity<InstrumentRefreshResponse> refreshInstrument(@PathVariable Long id,
            @RequestParam(required = false) Integer days) {

        int lookback = days == null ? defaultLookbackDays : days;
        if (lookback < 1) {
            throw new IllegalArgumentException("days must be at least 1");
        }
        log.info("POST /admin/instruments/{}/refresh - Days: {}", id, lookback);

        RefreshOutcome outcome = orchestrator.refreshOne(id, lookback);
        InstrumentRefreshResponse body = InstrumentRefreshResponse.builder()
                .instrumentId(id)
                .outcome(outcome)
                .success(outcome.isSuccess())
                .build();
        HttpStatus status = outcome == RefreshOutcome.NOT_FOUND ? HttpStatus.NOT_FOUND : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Recompute indicators of one instrument.
     */
    @PostMapping("/instruments/{id}/indicators")
    public ResponseEntity<IndicatorResponse> computeIndicators(@PathVariable Long id,
            @RequestBody(required = false) IndicatorRequest request) {

        Set<IndicatorKind> kinds = request == null || request.getKinds() == null || request.getKinds().isEmpty()
                ? IndicatorKind.defaults()
                : request.getKinds();
        log.info("POST /admin/instruments/{}/indicators - Kinds: {}", id, kinds);

        Map<IndicatorKind, Integer> written = indicatorService.computeIndicators(id, kinds);
        return ResponseEntity.ok(IndicatorResponse.builder()
                .instrumentId(id)
                .pointsWritten(written)
                .build());
    }

    /**
     * Stored indicator series of one instrument, oldest first.
     */
    @GetMapping("/instruments/{id}/indicators/{kind}")
    public ResponseEntity<List<IndicatorPointResponse>> getIndicatorSeries(@PathVariable Long id,
            @PathVariable IndicatorKind kind, @RequestParam(required = false) Integer period) {

        log.info("GET /admin/instruments/{}/indicators/{} - Period: {}", id, kind, period);

        List<IndicatorPointResponse> points = indicatorService.getIndicatorSeries(id, kind, period).stream()
                .map(IndicatorPointResponse::from)
                .collect(Collectors.toList());
        return ResponseEntity.ok(points);
    }

    @PostMapping("/scheduler/start")
    public ResponseEntity<SchedulerStatusResponse> startScheduler() {
        log.info("POST /admin/scheduler/start");
        scheduler.start();
        return ResponseEntity.ok(status());
    }

    @PostMapping("/scheduler/stop")
    public ResponseEntity<SchedulerStatusResponse> stopScheduler() {
        log.info("POST /admin/scheduler/stop");
        scheduler.stop();
        return ResponseEntity.ok(status());
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<SchedulerStatusResponse> schedulerStatus() {
        return ResponseEntity.ok(status());
    }

    private SchedulerStatusResponse status() {
        return SchedulerStatusResponse.builder()
                .running(scheduler.isRunning())
                .tasks(scheduler.getTaskNames())
                .build();
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
