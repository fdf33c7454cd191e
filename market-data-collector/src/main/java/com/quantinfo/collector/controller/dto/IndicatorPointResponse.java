package com.quantinfo.collector.controller.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.quantinfo.collector.domain.IndicatorKind;
import com.quantinfo.collector.domain.TechnicalIndicatorPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One stored indicator value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IndicatorPointResponse {

    @JsonFormat(pattern = "yyyy-MM-dd")
    private LocalDate date;
    private IndicatorKind kind;
    private Integer period;
    private Double value;
    private Double signalValue;

    public static IndicatorPointResponse from(TechnicalIndicatorPoint point) {
        return IndicatorPointResponse.builder()
                .date(point.getIndicatorDate())
                .kind(point.getKind())
                .period(point.getPeriod())
                .value(point.getValue())
                .signalValue(point.getSignalValue())
                .build();
    }
}
