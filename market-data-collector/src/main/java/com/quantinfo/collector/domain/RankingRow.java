package com.quantinfo.collector.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * One row of a ranking list. Only the measurements of the ranked dimension are populated;
 * composite rows additionally carry the normalized score of every contributing dimension.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RankingRow {

    private Integer rank;
    private String symbol;
    private String name;
    private String sector;
    private RankingDimension dimension;

    private Double currentPrice;
    private LocalDate tradeDate;

    // activity
    private Long volume;
    private Double turnover;

    // volatility
    private Double high;
    private Double low;
    private Double dailyRange;
    private Double volatilityPercent;
    private Double intradayMove;
    private Double movePercent;

    // performance
    private Double open;
    private Double priceChange;
    private Double percentChange;
    private PriceDirection direction;

    // market cap
    private Double marketCap;
    private Double marketCapBillions;

    private Double score;

    private Map<RankingDimension, Double> dimensionScores;
}
