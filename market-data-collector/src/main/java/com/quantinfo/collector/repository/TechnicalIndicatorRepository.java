package com.quantinfo.collector.repository;

import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.TechnicalIndicatorPoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for computed indicator series.
 */
@Repository
public interface TechnicalIndicatorRepository extends JpaRepository<TechnicalIndicatorPoint, Long> {

    /**
     * Remove every point of one indicator kind for an instrument.
     *
     * @return number of deleted points
     */
    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM TechnicalIndicatorPoint t WHERE t.instrument.id = :instrumentId AND t.kind = :kind")
    int deleteByInstrumentAndKind(@Param("instrumentId") Long instrumentId, @Param("kind") IndicatorKind kind);

    List<TechnicalIndicatorPoint> findByInstrumentIdAndKindAndPeriodOrderByIndicatorDateAsc(Long instrumentId,
            IndicatorKind kind, Integer period);

    List<TechnicalIndicatorPoint> findByInstrumentIdAndKindOrderByIndicatorDateAsc(Long instrumentId,
            IndicatorKind kind);

    long countByInstrumentIdAndKind(Long instrumentId, IndicatorKind kind);
}
