package com.quantinfo.collector.service;

import com.quantinfo.collector.config.RankingProperties;
import com.quantinfo.collector.domain.MarketSnapshot;
import com.quantinfo.collector.domain.PriceDirection;
import com.quantinfo.collector.domain.RankingDimension;
import com.quantinfo.collector.domain.RankingRow;
import com.quantinfo.collector.repository.PriceBarRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;

/**
 * Service producing dimension rankings over the latest price snapshot of the ranked universe.
 * Every dimension orders by its measurement descending with ties broken by symbol ascending,
 * so repeated calls over the same snapshot return identical lists.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RankingService {

    private static final double BILLION = 1_000_000_000d;

    private final PriceBarRepository priceBarRepository;
    private final RankingProperties properties;
    private final IngestionMetricsService metricsService;

    /**
     * Row limit a request is served with: the configured default when none is given,
     * capped at the configured maximum.
     *
     * @throws IllegalArgumentException if the requested limit is below 1
     */
    public int resolveLimit(Integer requested) {
        return checkLimit(requested == null ? properties.getDefaultLimit() : requested);
    }

    /**
     * Ranking of one dimension, at most {@code limit} rows ranked 1..n.
     * An empty list means no price data is stored yet.
     */
    @Transactional(readOnly = true)
    public List<RankingRow> getRanking(RankingDimension dimension, int limit) {
        int effectiveLimit = checkLimit(limit);
        metricsService.recordRankingRequest(dimension);
        List<RankingRow> rows = rank(dimension, loadSnapshots(), effectiveLimit);
        log.info("Generated {} ranking for {} instruments", dimension.getPath(), rows.size());
        return rows;
    }

    /**
     * Every dimension computed from the same snapshot, in declaration order.
     */
    @Transactional(readOnly = true)
    public Map<RankingDimension, List<RankingRow>> getAllRankings(int limit) {
        int effectiveLimit = checkLimit(limit);
        List<MarketSnapshot> snapshots = loadSnapshots();
        Map<RankingDimension, List<RankingRow>> result = new EnumMap<>(RankingDimension.class);
        for (RankingDimension dimension : RankingDimension.values()) {
            metricsService.recordRankingRequest(dimension);
            result.put(dimension, rank(dimension, snapshots, effectiveLimit));
        }
        return result;
    }

    List<MarketSnapshot> loadSnapshots() {
        return priceBarRepository.findLatestBarsForSymbols(properties.getUniverse()).stream()
                .map(MarketSnapshot::of)
                .collect(Collectors.toList());
    }

    List<RankingRow> rank(RankingDimension dimension, List<MarketSnapshot> snapshots, int limit) {
        switch (dimension) {
            case ACTIVITY:
                return rankBy(snapshots, limit, s -> s.getVolume(), this::activityRow);
            case VOLATILITY:
                return rankBy(snapshots, limit, MarketSnapshot::volatilityPercent, this::volatilityRow);
            case PERFORMANCE:
                return rankBy(snapshots, limit, MarketSnapshot::percentChange, this::performanceRow);
            case MARKET_CAP:
                List<MarketSnapshot> withCap = snapshots.stream()
                        .filter(s -> s.getMarketCap() != null)
                        .collect(Collectors.toList());
                return rankBy(withCap, limit, MarketSnapshot::getMarketCap, this::marketCapRow);
            case PRICE:
                return rankBy(snapshots, limit, MarketSnapshot::getClose, this::priceRow);
            case COMPREHENSIVE:
                return composite(snapshots, limit);
            default:
                throw new IllegalArgumentException("Unsupported ranking dimension: " + dimension);
        }
    }

    private List<RankingRow> rankBy(List<MarketSnapshot> snapshots, int limit, ToDoubleFunction<MarketSnapshot> measure,
            Function<MarketSnapshot, RankingRow> toRow) {
        Comparator<MarketSnapshot> order = Comparator.comparingDouble(measure).reversed()
                .thenComparing(MarketSnapshot::getSymbol);
        List<MarketSnapshot> sorted = snapshots.stream().sorted(order).limit(limit).collect(Collectors.toList());
        List<RankingRow> rows = new ArrayList<>(sorted.size());
        for (int i = 0; i < sorted.size(); i++) {
            RankingRow row = toRow.apply(sorted.get(i));
            row.setRank(i + 1);
            rows.add(row);
        }
        return rows;
    }

    private List<RankingRow> composite(List<MarketSnapshot> snapshots, int limit) {
        Map<RankingDimension, Double> weights = properties.getWeights().asMap();
        Map<String, MarketSnapshot> bySymbol = snapshots.stream()
                .collect(Collectors.toMap(MarketSnapshot::getSymbol, s -> s, (a, b) -> a, LinkedHashMap::new));

        Map<String, Map<RankingDimension, Double>> scores = new LinkedHashMap<>();
        for (RankingDimension dimension : weights.keySet()) {
            for (RankingRow row : rank(dimension, snapshots, limit)) {
                double normalized = (double) (limit - row.getRank() + 1) / limit * 100;
                scores.computeIfAbsent(row.getSymbol(), k -> new EnumMap<>(RankingDimension.class))
                        .put(dimension, normalized);
            }
        }

        List<RankingRow> rows = new ArrayList<>(scores.size());
        for (Map.Entry<String, Map<RankingDimension, Double>> entry : scores.entrySet()) {
            Map<RankingDimension, Double> dimensionScores = new EnumMap<>(RankingDimension.class);
            double total = 0;
            for (Map.Entry<RankingDimension, Double> weight : weights.entrySet()) {
                double score = entry.getValue().getOrDefault(weight.getKey(), 0d);
                dimensionScores.put(weight.getKey(), score);
                total += score * weight.getValue();
            }
            MarketSnapshot snapshot = bySymbol.get(entry.getKey());
            rows.add(baseRow(snapshot, RankingDimension.COMPREHENSIVE).toBuilder()
                    .score(total)
                    .dimensionScores(dimensionScores)
                    .build());
        }

        rows.sort(Comparator.comparing(RankingRow::getScore, Comparator.reverseOrder())
                .thenComparing(RankingRow::getSymbol));
        List<RankingRow> top = new ArrayList<>(rows.subList(0, Math.min(limit, rows.size())));
        for (int i = 0; i < top.size(); i++) {
            top.get(i).setRank(i + 1);
        }
        return top;
    }

    // ── Row builders ─────────────────────────────────────────────────────────

    private RankingRow activityRow(MarketSnapshot s) {
        RankingProperties.Scoring scoring = properties.getScoring();
        double turnover = s.turnover();
        double score = Math.min(s.getVolume() / scoring.getVolumeCap() * 70, 70)
                + Math.min(turnover / scoring.getTurnoverCap() * 30, 30);
        return baseRow(s, RankingDimension.ACTIVITY).toBuilder()
                .volume(s.getVolume())
                .turnover(turnover)
                .score(score)
                .build();
    }

    private RankingRow volatilityRow(MarketSnapshot s) {
        double volatilityPercent = s.volatilityPercent();
        double movePercent = Math.abs(s.percentChange());
        double score = Math.min(volatilityPercent * 10, 60) + Math.min(movePercent * 10, 40);
        return baseRow(s, RankingDimension.VOLATILITY).toBuilder()
                .high(s.getHigh())
                .low(s.getLow())
                .open(s.getOpen())
                .dailyRange(s.getHigh() - s.getLow())
                .volatilityPercent(volatilityPercent)
                .intradayMove(Math.abs(s.getClose() - s.getOpen()))
                .movePercent(movePercent)
                .score(score)
                .build();
    }

    private RankingRow performanceRow(MarketSnapshot s) {
        double percentChange = s.percentChange();
        return baseRow(s, RankingDimension.PERFORMANCE).toBuilder()
                .open(s.getOpen())
                .volume(s.getVolume())
                .priceChange(s.getClose() - s.getOpen())
                .percentChange(percentChange)
                .direction(PriceDirection.of(s.getOpen(), s.getClose()))
                .score(Math.abs(percentChange))
                .build();
    }

    private RankingRow marketCapRow(MarketSnapshot s) {
        double marketCap = s.getMarketCap();
        return baseRow(s, RankingDimension.MARKET_CAP).toBuilder()
                .volume(s.getVolume())
                .marketCap(marketCap)
                .marketCapBillions(marketCap / BILLION)
                .score(Math.min(marketCap / properties.getScoring().getMarketCapCap() * 100, 100))
                .build();
    }

    private RankingRow priceRow(MarketSnapshot s) {
        return baseRow(s, RankingDimension.PRICE).toBuilder()
                .high(s.getHigh())
                .low(s.getLow())
                .open(s.getOpen())
                .volume(s.getVolume())
                .percentChange(s.percentChange())
                .score(s.getClose())
                .build();
    }

    private static RankingRow baseRow(MarketSnapshot s, RankingDimension dimension) {
        return RankingRow.builder()
                .symbol(s.getSymbol())
                .name(s.getName())
                .sector(s.getSector())
                .currentPrice(s.getClose())
                .tradeDate(s.getTradeDate())
                .dimension(dimension)
                .build();
    }

    private int checkLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, was " + limit);
        }
        return Math.min(limit, properties.getMaxLimit());
    }
}
