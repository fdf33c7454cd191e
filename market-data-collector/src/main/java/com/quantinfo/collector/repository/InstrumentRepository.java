package com.quantinfo.collector.repository;

import com.quantinfo.collector.domain.Instrument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Repository for the instrument universe.
 */
@Repository
public interface InstrumentRepository extends JpaRepository<Instrument, Long> {

    @Query("SELECT i.id FROM Instrument i WHERE i.active = true ORDER BY i.symbol ASC")
    List<Long> findActiveIds();

    List<Instrument> findBySymbolIn(Collection<String> symbols);
}
