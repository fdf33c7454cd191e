package com.quantinfo.collector.config;

import com.quantinfo.collector.infrastructure.DailyIngestionTask;
import com.quantinfo.collector.infrastructure.IndicatorRecomputeTask;
import com.quantinfo.collector.infrastructure.IntradayQuoteTask;
import com.quantinfo.collector.infrastructure.MarketDataScheduler;
import com.quantinfo.collector.infrastructure.TradingWindow;
import com.quantinfo.collector.service.IngestionMetricsService;
import com.quantinfo.collector.service.IngestionOrchestrator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * Wires the periodic tasks and the scheduler that owns them.
 */
@Configuration
public class SchedulerConfig {

    @Value("${scheduler.enabled:false}")
    private boolean enabled;

    @Value("${scheduler.zone:America/New_York}")
    private String zone;

    @Value("${scheduler.daily-update-time:02:00}")
    private String dailyUpdateTime;

    @Value("${scheduler.daily-lookback-days:7}")
    private int dailyLookbackDays;

    @Value("${scheduler.intraday-interval:5m}")
    private Duration intradayInterval;

    @Value("${scheduler.off-hours-interval:1h}")
    private Duration offHoursInterval;

    @Value("${scheduler.indicator-time:18:00}")
    private String indicatorTime;

    @Value("${scheduler.error-backoff:1h}")
    private Duration errorBackoff;

    @Bean
    public Clock marketClock() {
        return Clock.system(ZoneId.of(zone));
    }

    @Bean
    public TradingWindow tradingWindow() {
        return TradingWindow.usEquities();
    }

    @Bean
    public MarketDataScheduler marketDataScheduler(IngestionOrchestrator orchestrator,
            IngestionMetricsService metricsService, TradingWindow tradingWindow, Clock marketClock) {
        return new MarketDataScheduler(List.of(
                new DailyIngestionTask(orchestrator, metricsService, marketClock, errorBackoff,
                        LocalTime.parse(dailyUpdateTime), dailyLookbackDays),
                new IntradayQuoteTask(orchestrator, metricsService, marketClock, errorBackoff,
                        tradingWindow, intradayInterval, offHoursInterval),
                new IndicatorRecomputeTask(orchestrator, metricsService, marketClock, errorBackoff,
                        LocalTime.parse(indicatorTime))),
                enabled);
    }
}
