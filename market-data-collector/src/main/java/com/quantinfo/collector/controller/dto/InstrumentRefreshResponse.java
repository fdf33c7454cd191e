package com.quantinfo.collector.controller.dto;

import com.quantinfo.collector.domain.RefreshOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InstrumentRefreshResponse {

    private Long instrumentId;
    private RefreshOutcome outcome;
    private boolean success;
}
