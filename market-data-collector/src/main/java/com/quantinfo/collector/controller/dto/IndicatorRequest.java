package com.quantinfo.collector.controller.dto;

import com.quantinfo.collector.domain.IndicatorKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Request DTO naming the indicator kinds to recompute. An empty set means all kinds.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IndicatorRequest {

    private Set<IndicatorKind> kinds;
}
