package com.quantinfo.collector.config;

import com.quantinfo.collector.domain.RankingDimension;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ranked universe, composite weights and the caps used by the dimension score heuristics.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ranking")
public class RankingProperties {

    private List<String> universe = new ArrayList<>(List.of(
            "AAPL", "MSFT", "NVDA", "META", "NFLX", "PYPL", "INTC", "CSCO", "ADBE", "QCOM"));

    private int defaultLimit = 10;

    private int maxLimit = 100;

    private Weights weights = new Weights();

    private Scoring scoring = new Scoring();

    @Getter
    @Setter
    public static class Weights {
        private double activity = 0.30;
        private double volatility = 0.25;
        private double performance = 0.20;
        private double marketCap = 0.15;
        private double price = 0.10;

        public Map<RankingDimension, Double> asMap() {
            Map<RankingDimension, Double> map = new EnumMap<>(RankingDimension.class);
            map.put(RankingDimension.ACTIVITY, activity);
            map.put(RankingDimension.VOLATILITY, volatility);
            map.put(RankingDimension.PERFORMANCE, performance);
            map.put(RankingDimension.MARKET_CAP, marketCap);
            map.put(RankingDimension.PRICE, price);
            return map;
        }
    }

    @Getter
    @Setter
    public static class Scoring {
        // volume at which the activity volume component saturates
        private double volumeCap = 1e8;
        private double turnoverCap = 5e10;
        private double marketCapCap = 3e12;
    }
}
