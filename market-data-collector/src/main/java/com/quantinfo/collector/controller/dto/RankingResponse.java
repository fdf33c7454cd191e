package com.quantinfo.collector.controller.dto;

import com.quantinfo.collector.domain.RankingRow;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for one ranking list.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RankingResponse {

    private String dimension;
    private int limit;
    private int count;
    private List<RankingRow> rankings;
}
