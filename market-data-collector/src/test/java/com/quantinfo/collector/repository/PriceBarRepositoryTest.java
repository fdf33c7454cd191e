package com.quantinfo.collector.repository;

import com.quantinfo.collector.config.JpaConfig;
import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.Instrument;
import com.quantinfo.collector.domain.PriceBar;
import com.quantinfo.collector.domain.TechnicalIndicatorPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the price and indicator queries and the storage constraints behind them.
 */
@DataJpaTest
@Import(JpaConfig.class)
class PriceBarRepositoryTest {

    @Autowired
    private InstrumentRepository instrumentRepository;

    @Autowired
    private PriceBarRepository priceBarRepository;

    @Autowired
    private TechnicalIndicatorRepository indicatorRepository;

    private Instrument apple;
    private Instrument microsoft;

    @BeforeEach
    void setUp() {
        apple = instrumentRepository.save(instrument("AAPL", true));
        microsoft = instrumentRepository.save(instrument("MSFT", true));
    }

    @Test
    void testFindLatestBarsForSymbols_OneRowPerInstrument() {
        // Arrange
        priceBarRepository.saveAll(List.of(
                bar(apple, LocalDate.of(2024, 1, 3), "184.25"),
                bar(apple, LocalDate.of(2024, 1, 4), "181.91"),
                bar(microsoft, LocalDate.of(2024, 1, 3), "370.60")));
        Instrument inactive = instrumentRepository.save(instrument("INTC", false));
        priceBarRepository.save(bar(inactive, LocalDate.of(2024, 1, 4), "48.00"));
        priceBarRepository.flush();

        // Act
        List<PriceBar> latest = priceBarRepository.findLatestBarsForSymbols(List.of("AAPL", "MSFT", "INTC"));

        // Assert
        Map<String, LocalDate> bySymbol = latest.stream()
                .collect(Collectors.toMap(b -> b.getInstrument().getSymbol(), PriceBar::getTradeDate));
        assertEquals(2, bySymbol.size());
        assertEquals(LocalDate.of(2024, 1, 4), bySymbol.get("AAPL"));
        assertEquals(LocalDate.of(2024, 1, 3), bySymbol.get("MSFT"));
    }

    @Test
    void testFindBarsSince_InclusiveAndOrderedByDate() {
        // Arrange
        priceBarRepository.saveAll(List.of(
                bar(apple, LocalDate.of(2024, 1, 5), "181.18"),
                bar(apple, LocalDate.of(2024, 1, 2), "185.64"),
                bar(apple, LocalDate.of(2024, 1, 4), "181.91"),
                bar(microsoft, LocalDate.of(2024, 1, 5), "367.75")));

        // Act
        List<PriceBar> since = priceBarRepository.findByInstrumentIdAndTradeDateGreaterThanEqualOrderByTradeDateAsc(
                apple.getId(), LocalDate.of(2024, 1, 4));

        // Assert
        assertEquals(List.of(LocalDate.of(2024, 1, 4), LocalDate.of(2024, 1, 5)),
                since.stream().map(PriceBar::getTradeDate).collect(Collectors.toList()));
    }

    @Test
    void testFindLatestBarsForSymbols_SymbolOutsideUniverse_Excluded() {
        priceBarRepository.save(bar(microsoft, LocalDate.of(2024, 1, 3), "370.60"));

        List<PriceBar> latest = priceBarRepository.findLatestBarsForSymbols(List.of("AAPL"));

        assertTrue(latest.isEmpty());
    }

    @Test
    void testUniqueInstrumentDate_Enforced() {
        priceBarRepository.saveAndFlush(bar(apple, LocalDate.of(2024, 1, 3), "184.25"));

        assertThrows(DataIntegrityViolationException.class,
                () -> priceBarRepository.saveAndFlush(bar(apple, LocalDate.of(2024, 1, 3), "185.00")),
                "Duplicate (instrument, date) should be rejected");
    }

    @Test
    void testFindTopByInstrument_ReturnsLatestBar() {
        priceBarRepository.saveAll(List.of(
                bar(apple, LocalDate.of(2024, 1, 2), "185.64"),
                bar(apple, LocalDate.of(2024, 1, 5), "181.18"),
                bar(apple, LocalDate.of(2024, 1, 3), "184.25")));

        assertEquals(LocalDate.of(2024, 1, 5),
                priceBarRepository.findTopByInstrumentIdOrderByTradeDateDesc(apple.getId()).orElseThrow().getTradeDate());
        assertTrue(priceBarRepository.findTopByInstrumentIdOrderByTradeDateDesc(microsoft.getId()).isEmpty());
    }

    @Test
    void testFindRecentBars_BoundedWindowNewestFirst() {
        // Arrange
        LocalDate start = LocalDate.of(2024, 1, 1);
        for (int i = 0; i < 30; i++) {
            priceBarRepository.save(bar(apple, start.plusDays(i), "100.00"));
        }

        // Act
        List<PriceBar> recent = priceBarRepository.findRecentBars(apple.getId(), PageRequest.of(0, 10));

        // Assert
        assertEquals(10, recent.size());
        assertEquals(start.plusDays(29), recent.get(0).getTradeDate());
        assertEquals(start.plusDays(20), recent.get(9).getTradeDate());
    }

    @Test
    void testFindTradeDates_WithinRange() {
        priceBarRepository.saveAll(List.of(
                bar(apple, LocalDate.of(2024, 1, 2), "185.64"),
                bar(apple, LocalDate.of(2024, 1, 3), "184.25"),
                bar(apple, LocalDate.of(2024, 1, 10), "186.19")));

        List<LocalDate> dates = priceBarRepository.findTradeDates(apple.getId(),
                LocalDate.of(2024, 1, 3), LocalDate.of(2024, 1, 9));

        assertEquals(List.of(LocalDate.of(2024, 1, 3)), dates);
    }

    @Test
    void testDeleteByInstrumentAndKind_LeavesOtherKindsAndInstruments() {
        // Arrange
        indicatorRepository.saveAll(List.of(
                point(apple, IndicatorKind.MA, 5),
                point(apple, IndicatorKind.MA, 10),
                point(apple, IndicatorKind.RSI, 14),
                point(microsoft, IndicatorKind.MA, 5)));

        // Act
        int deleted = indicatorRepository.deleteByInstrumentAndKind(apple.getId(), IndicatorKind.MA);

        // Assert
        assertEquals(2, deleted);
        assertEquals(0, indicatorRepository.countByInstrumentIdAndKind(apple.getId(), IndicatorKind.MA));
        assertEquals(1, indicatorRepository.countByInstrumentIdAndKind(apple.getId(), IndicatorKind.RSI));
        assertEquals(1, indicatorRepository.countByInstrumentIdAndKind(microsoft.getId(), IndicatorKind.MA));
    }

    @Test
    void testFindActiveIds_ExcludesInactive() {
        Instrument inactive = instrumentRepository.save(instrument("INTC", false));

        List<Long> ids = instrumentRepository.findActiveIds();

        assertTrue(ids.contains(apple.getId()));
        assertTrue(ids.contains(microsoft.getId()));
        assertFalse(ids.contains(inactive.getId()));
    }

    private static Instrument instrument(String symbol, boolean active) {
        return Instrument.builder()
                .symbol(symbol)
                .name(symbol + " Inc")
                .exchange("NASDAQ")
                .active(active)
                .build();
    }

    private static PriceBar bar(Instrument instrument, LocalDate date, String close) {
        BigDecimal price = new BigDecimal(close);
        return PriceBar.builder()
                .instrument(instrument)
                .tradeDate(date)
                .open(price)
                .high(price.add(BigDecimal.ONE))
                .low(price.subtract(BigDecimal.ONE))
                .close(price)
                .volume(1_000_000L)
                .build();
    }

    private static TechnicalIndicatorPoint point(Instrument instrument, IndicatorKind kind, int period) {
        return TechnicalIndicatorPoint.builder()
                .instrument(instrument)
                .indicatorDate(LocalDate.of(2024, 1, 5))
                .kind(kind)
                .period(period)
                .value(50.0)
                .build();
    }
}
