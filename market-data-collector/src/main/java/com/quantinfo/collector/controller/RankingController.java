package com.quantinfo.collector.controller;

import com.quantinfo.collector.controller.dto.ErrorResponse;
import com.quantinfo.collector.controller.dto.RankingResponse;
import com.quantinfo.collector.domain.RankingDimension;
import com.quantinfo.collector.domain.RankingRow;
import com.quantinfo.collector.service.RankingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for stock rankings.
 */
@RestController
@RequestMapping("/rankings")
@RequiredArgsConstructor
@Slf4j
public class RankingController {

    private final RankingService rankingService;

    /**
     * Ranking of one dimension.
     *
     * @param dimension activity, volatility, performance, market-cap, price or comprehensive
     * @param limit     maximum number of rows, the configured default when absent
     * @return the ranking, or 404 when no price data is stored yet
     */
    @GetMapping("/{dimension}")
    public ResponseEntity<?> getRanking(@PathVariable String dimension,
            @RequestParam(required = false) Integer limit) {

        log.info("GET /rankings/{} - limit: {}", dimension, limit);

        RankingDimension resolved = RankingDimension.fromPath(dimension)
                .orElseThrow(() -> new IllegalArgumentException("Unknown ranking dimension: " + dimension));

        int applied = rankingService.resolveLimit(limit);
        List<RankingRow> rows = rankingService.getRanking(resolved, applied);
        if (rows.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.builder()
                    .status(HttpStatus.NOT_FOUND.value())
                    .error(HttpStatus.NOT_FOUND.getReasonPhrase())
                    .message("No " + resolved.getPath() + " ranking data available")
                    .timestamp(Instant.now())
                    .build());
        }
        return ResponseEntity.ok(toResponse(resolved, applied, rows));
    }

    /**
     * Every dimension in one call.
     */
    @GetMapping
    public ResponseEntity<Map<String, RankingResponse>> getAllRankings(
            @RequestParam(required = false) Integer limit) {

        log.info("GET /rankings - limit: {}", limit);

        int applied = rankingService.resolveLimit(limit);
        Map<String, RankingResponse> body = new LinkedHashMap<>();
        rankingService.getAllRankings(applied)
                .forEach((dimension, rows) -> body.put(dimension.getPath(), toResponse(dimension, applied, rows)));
        return ResponseEntity.ok(body);
    }

    private static RankingResponse toResponse(RankingDimension dimension, int limit, List<RankingRow> rows) {
        return RankingResponse.builder()
                .dimension(dimension.getPath())
                .limit(limit)
                .count(rows.size())
                .rankings(rows)
                .build();
    }
}
