package com.quantinfo.collector.repository;

import com.quantinfo.collector.domain.PriceBar;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for daily price bars.
 */
@Repository
public interface PriceBarRepository extends JpaRepository<PriceBar, Long> {

    /**
     * Most recent stored bar of an instrument.
     */
    Optional<PriceBar> findTopByInstrumentIdOrderByTradeDateDesc(Long instrumentId);

    /**
     * Trade dates already stored for an instrument within a date range.
     */
    @Query("SELECT b.tradeDate FROM PriceBar b WHERE b.instrument.id = :instrumentId " +
            "AND b.tradeDate >= :startDate AND b.tradeDate <= :endDate")
    List<LocalDate> findTradeDates(
            @Param("instrumentId") Long instrumentId,
            @Param("startDate") LocalDate startDate,
            @Param("endDate") LocalDate endDate);

    /**
     * Bars of an instrument on or after a date, ordered by date.
     */
    List<PriceBar> findByInstrumentIdAndTradeDateGreaterThanEqualOrderByTradeDateAsc(Long instrumentId,
            LocalDate since);

    /**
     * Most recent bars of an instrument, newest first. The page size bounds the window.
     */
    @Query("SELECT b FROM PriceBar b WHERE b.instrument.id = :instrumentId ORDER BY b.tradeDate DESC")
    List<PriceBar> findRecentBars(@Param("instrumentId") Long instrumentId, Pageable pageable);

    long countByInstrumentId(Long instrumentId);

    /**
     * Latest bar of each active instrument whose symbol is in the given set.
     * Reads one row per instrument rather than the full history.
     */
    @Query("SELECT b FROM PriceBar b JOIN FETCH b.instrument i " +
            "WHERE i.active = true AND i.symbol IN :symbols " +
            "AND b.tradeDate = (SELECT MAX(b2.tradeDate) FROM PriceBar b2 WHERE b2.instrument = i)")
    List<PriceBar> findLatestBarsForSymbols(@Param("symbols") Collection<String> symbols);
}
