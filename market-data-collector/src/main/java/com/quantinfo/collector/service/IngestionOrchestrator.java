package com.quantinfo.collector.service;

import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.RefreshOutcome;
import com.quantinfo.collector.domain.RefreshTally;
import com.quantinfo.collector.provider.InstrumentProfile;
import com.quantinfo.collector.provider.Quote;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Service interface coordinating provider calls and storage for the instrument universe.
 * Batch operations never throw for individual instrument failures; they report them in a tally.
 */
public interface IngestionOrchestrator {

    /**
     * Bring the stored history of one instrument up to date.
     * The fetch window is {@code [max(today - lookbackDays, lastStored + 1), today]};
     * an empty window returns {@link RefreshOutcome#ALREADY_CURRENT} without calling the provider.
     *
     * @param instrumentId the instrument to refresh
     * @param lookbackDays how far back to look when little or no history is stored
     * @return the outcome; unexpected errors are reported as {@link RefreshOutcome#FAILED}
     */
    RefreshOutcome refreshOne(Long instrumentId, int lookbackDays);

    /**
     * Refresh every active instrument on the ingestion pool.
     */
    RefreshTally refreshAll(int lookbackDays);

    /**
     * Refresh the given instruments on the ingestion pool.
     */
    RefreshTally refreshInstruments(Collection<Long> instrumentIds, int lookbackDays);

    /**
     * Start a refresh in the background and return a future of its tally.
     *
     * @param instrumentIds instruments to refresh, or null/empty for every active instrument
     */
    CompletableFuture<RefreshTally> submitRefresh(Collection<Long> instrumentIds, int lookbackDays);

    /**
     * Latest quotes of the active instruments among the given ids, keyed by instrument id.
     */
    Map<Long, Quote> fetchRealtimeQuotes(Collection<Long> instrumentIds) throws InterruptedException;

    /**
     * Provider search results, at most {@code limit}, flagged when already part of the universe.
     */
    List<InstrumentProfile> searchInstruments(String query, int limit) throws InterruptedException;

    /**
     * Fill in descriptive fields of an instrument from the provider profile.
     * Only non-null profile values overwrite stored ones.
     *
     * @return true if the instrument changed
     */
    boolean enrichProfile(Long instrumentId) throws InterruptedException;

    /**
     * Ids of all active instruments.
     */
    List<Long> activeInstrumentIds();

    /**
     * Recompute the given indicator kinds for every active instrument on the ingestion pool.
     * Instruments with too little history count as {@link RefreshOutcome#NO_DATA}.
     */
    RefreshTally recomputeIndicators(Collection<IndicatorKind> kinds);
}
