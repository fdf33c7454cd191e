package com.quantinfo.collector.controller.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for a manual refresh. Omitting the ids refreshes every active instrument.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RefreshRequest {

    private List<Long> instrumentIds;

    @Min(value = 1, message = "Days must be at least 1")
    @Max(value = 3650, message = "Days must be at most 3650")
    private Integer days;
}
