package com.quantinfo.collector.controller.dto;

import com.quantinfo.collector.domain.IndicatorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IndicatorResponse {

    private Long instrumentId;
    private Map<IndicatorKind, Integer> pointsWritten;
}
