package com.quantinfo.collector.concurrency;

import com.quantinfo.collector.domain.Instrument;
import com.quantinfo.collector.domain.RefreshOutcome;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.provider.DataProvider;
import com.quantinfo.collector.provider.HistoricalBar;
import com.quantinfo.collector.provider.InstrumentProfile;
import com.quantinfo.collector.provider.Quote;
import com.quantinfo.collector.provider.RateLimitGate;
import com.quantinfo.collector.repository.InstrumentRepository;
import com.quantinfo.collector.repository.PriceBarRepository;
import com.quantinfo.collector.service.IndicatorService;
import com.quantinfo.collector.service.IngestionMetricsService;
import com.quantinfo.collector.service.IngestionOrchestratorImpl;
import com.quantinfo.collector.service.PriceBarIngestionService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.LongStream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

/**
 * Concurrency tests for batch refreshes: bounded parallelism and provider call spacing.
 */
@ExtendWith(MockitoExtension.class)
class IngestionConcurrencyTest {

    private static final int POOL_SIZE = 2;
    private static final int INSTRUMENTS = 6;

    @Mock
    private InstrumentRepository instrumentRepository;

    @Mock
    private PriceBarRepository priceBarRepository;

    @Mock
    private PriceBarIngestionService priceBarIngestionService;

    @Mock
    private IndicatorService indicatorService;

    @Mock
    private IngestionMetricsService metricsService;

    private ExecutorService ingestionExecutor;

    @BeforeEach
    void setUp() {
        ingestionExecutor = Executors.newFixedThreadPool(POOL_SIZE);

        Map<Long, Instrument> instruments = LongStream.rangeClosed(1, INSTRUMENTS).boxed()
                .collect(Collectors.toMap(id -> id, id -> Instrument.builder()
                        .id(id)
                        .symbol("SYM" + id)
                        .name("Instrument " + id)
                        .sector("Technology")
                        .marketCap(1.0e11)
                        .build()));
        when(instrumentRepository.findById(anyLong()))
                .thenAnswer(inv -> Optional.ofNullable(instruments.get(inv.<Long>getArgument(0))));
        when(instrumentRepository.findAllById(anyCollection())).thenReturn(new ArrayList<>(instruments.values()));
        when(priceBarRepository.findTopByInstrumentIdOrderByTradeDateDesc(anyLong())).thenReturn(Optional.empty());
        when(priceBarIngestionService.ingest(anyLong(), any())).thenReturn(1);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        ingestionExecutor.shutdownNow();
        ingestionExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void testRefreshInstruments_InFlightCallsBoundedByPoolSize() {
        // Arrange
        TrackingProvider provider = new TrackingProvider(new RateLimitGate(Duration.ZERO), 50);
        IngestionOrchestratorImpl orchestrator = orchestrator(provider);

        // Act
        RefreshTally tally = orchestrator.refreshInstruments(ids(), 7);

        // Assert
        assertEquals(INSTRUMENTS, tally.getTotal());
        assertEquals(INSTRUMENTS, tally.getSuccess());
        assertTrue(provider.maxInFlight.get() <= POOL_SIZE, "max in flight was " + provider.maxInFlight.get());
        assertTrue(provider.maxInFlight.get() >= 1);
    }

    @Test
    void testRefreshInstruments_ProviderCallsSpacedByGate() {
        // Arrange
        long intervalMs = 100;
        TrackingProvider provider = new TrackingProvider(new RateLimitGate(Duration.ofMillis(intervalMs)), 0);
        IngestionOrchestratorImpl orchestrator = orchestrator(provider);

        // Act
        RefreshTally tally = orchestrator.refreshInstruments(ids(), 7);

        // Assert
        assertEquals(INSTRUMENTS, tally.getSuccess());
        List<Long> starts = new ArrayList<>(provider.callTimes);
        Collections.sort(starts);
        assertEquals(INSTRUMENTS, starts.size());
        for (int i = 1; i < starts.size(); i++) {
            long gap = starts.get(i) - starts.get(i - 1);
            assertTrue(gap >= intervalMs - 20, "calls " + (i - 1) + " and " + i + " only " + gap + "ms apart");
        }
    }

    @Test
    void testRefreshInstruments_DuplicateIds_ProcessedOnce() {
        TrackingProvider provider = new TrackingProvider(new RateLimitGate(Duration.ZERO), 0);
        IngestionOrchestratorImpl orchestrator = orchestrator(provider);

        RefreshTally tally = orchestrator.refreshInstruments(List.of(1L, 1L, 2L), 7);

        assertEquals(2, tally.getTotal());
        assertEquals(2, provider.callTimes.size());
    }

    private IngestionOrchestratorImpl orchestrator(DataProvider provider) {
        return new IngestionOrchestratorImpl(
                instrumentRepository,
                priceBarRepository,
                priceBarIngestionService,
                indicatorService,
                provider,
                metricsService,
                Clock.systemUTC(),
                ingestionExecutor,
                Runnable::run);
    }

    private static List<Long> ids() {
        return LongStream.rangeClosed(1, INSTRUMENTS).boxed().collect(Collectors.toList());
    }

    /**
     * Provider that passes every history call through a gate and records concurrency.
     */
    private static class TrackingProvider implements DataProvider {

        private final RateLimitGate gate;
        private final long workMillis;
        private final AtomicInteger inFlight = new AtomicInteger();
        private final AtomicInteger maxInFlight = new AtomicInteger();
        private final List<Long> callTimes = new CopyOnWriteArrayList<>();

        TrackingProvider(RateLimitGate gate, long workMillis) {
            this.gate = gate;
            this.workMillis = workMillis;
        }

        @Override
        public String getName() {
            return "tracking";
        }

        @Override
        public List<HistoricalBar> fetchHistory(String symbol, LocalDate startDate, LocalDate endDate)
                throws InterruptedException {
            int current = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(current, Math::max);
            try {
                gate.acquire();
                callTimes.add(System.currentTimeMillis());
                if (workMillis > 0) {
                    Thread.sleep(workMillis);
                }
                return List.of(HistoricalBar.builder()
                        .date(endDate)
                        .open(new BigDecimal("10"))
                        .high(new BigDecimal("11"))
                        .low(new BigDecimal("9"))
                        .close(new BigDecimal("10.5"))
                        .volume(100L)
                        .build());
            } finally {
                inFlight.decrementAndGet();
            }
        }

        @Override
        public Map<String, Quote> fetchRealtimeBatch(Collection<String> symbols) {
            return Collections.emptyMap();
        }

        @Override
        public List<InstrumentProfile> search(String query) {
            return Collections.emptyList();
        }

        @Override
        public Optional<InstrumentProfile> getProfile(String symbol) {
            return Optional.empty();
        }
    }
}
