package com.quantinfo.collector.provider;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of market data for equities.
 * Implementations own their wire format and rate limiting; transport and parse failures
 * are logged and reported as empty results, never thrown.
 * Every call may block on the provider's rate-limit gate and therefore honours interruption.
 */
public interface DataProvider {

    /**
     * Provider identifier used in logs and metric tags.
     */
    String getName();

    /**
     * Fetch daily bars within [startDate, endDate], ascending by date.
     * Bars failing the OHLC sanity checks are dropped.
     *
     * @return bars in the window, or an empty list when the provider has none
     */
    List<HistoricalBar> fetchHistory(String symbol, LocalDate startDate, LocalDate endDate)
            throws InterruptedException;

    /**
     * Fetch the latest quote of each symbol. Symbols the provider could not resolve are absent.
     */
    Map<String, Quote> fetchRealtimeBatch(Collection<String> symbols) throws InterruptedException;

    /**
     * Search instruments by keyword. Returns at most {@link #MAX_SEARCH_RESULTS} candidates.
     */
    List<InstrumentProfile> search(String query) throws InterruptedException;

    /**
     * Descriptive profile of an instrument, empty when the provider has no record.
     */
    Optional<InstrumentProfile> getProfile(String symbol) throws InterruptedException;

    int MAX_SEARCH_RESULTS = 10;
}
