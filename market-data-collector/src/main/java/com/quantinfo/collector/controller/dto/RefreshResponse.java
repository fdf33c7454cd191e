package com.quantinfo.collector.controller.dto;

import com.quantinfo.collector.domain.RefreshOutcome;
import com.quantinfo.collector.domain.RefreshTally;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Response DTO carrying the tally of a finished manual refresh.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RefreshResponse {

    private int total;
    private int success;
    private int failed;
    private Map<String, RefreshOutcome> failures;
    private long elapsedMs;

    public static RefreshResponse from(RefreshTally tally) {
        return RefreshResponse.builder()
                .total(tally.getTotal())
                .success(tally.getSuccess())
                .failed(tally.getFailed())
                .failures(tally.getFailures())
                .elapsedMs(tally.getElapsedMillis())
                .build();
    }
}
