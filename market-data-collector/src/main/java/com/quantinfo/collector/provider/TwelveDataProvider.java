package com.quantinfo.collector.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DataProvider} backed by the Twelve Data REST API.
 * Quotes for a whole batch are fetched in a single call.
 */
@Slf4j
public class TwelveDataProvider implements DataProvider {

    public static final String NAME = "twelvedata";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final RateLimitGate gate;

    public TwelveDataProvider(RestClient restClient, ObjectMapper objectMapper, String apiKey, RateLimitGate gate) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.gate = gate;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<HistoricalBar> fetchHistory(String symbol, LocalDate startDate, LocalDate endDate)
            throws InterruptedException {
        JsonNode values = get("/time_series", symbol,
                "symbol", symbol,
                "interval", "1day",
                "start_date", startDate.toString(),
                "end_date", endDate.toString(),
                "format", "JSON").path("values");
        if (!values.isArray()) {
            log.warn("No price data available for {}", symbol);
            return Collections.emptyList();
        }

        List<HistoricalBar> bars = new ArrayList<>();
        for (JsonNode item : values) {
            LocalDate date = JsonValues.date(item, "datetime");
            if (date == null || date.isBefore(startDate) || date.isAfter(endDate)) {
                continue;
            }
            Long volume = JsonValues.whole(item, "volume");
            HistoricalBar bar = HistoricalBar.builder()
                    .date(date)
                    .open(JsonValues.decimal(item, "open"))
                    .high(JsonValues.decimal(item, "high"))
                    .low(JsonValues.decimal(item, "low"))
                    .close(JsonValues.decimal(item, "close"))
                    .volume(volume == null ? 0L : volume)
                    .adjustedClose(JsonValues.decimal(item, "close"))
                    .build();
            if (bar.isValid()) {
                bars.add(bar);
            } else {
                log.warn("Dropping invalid bar for {} on {}: {}", symbol, date, item);
            }
        }
        bars.sort(Comparator.comparing(HistoricalBar::getDate));
        log.info("Fetched {} bars for {} between {} and {}", bars.size(), symbol, startDate, endDate);
        return bars;
    }

    @Override
    public Map<String, Quote> fetchRealtimeBatch(Collection<String> symbols) throws InterruptedException {
        if (symbols.isEmpty()) {
            return Collections.emptyMap();
        }
        JsonNode root = get("/quote", String.join(",", symbols), "symbol", String.join(",", symbols));
        Map<String, Quote> quotes = new LinkedHashMap<>();
        if (!root.isObject()) {
            return quotes;
        }
        // a single-symbol request returns the quote itself, a batch returns an object keyed by symbol
        if (root.has("symbol")) {
            Quote quote = toQuote(root);
            quotes.put(quote.getSymbol(), quote);
            return quotes;
        }
        for (String symbol : symbols) {
            JsonNode node = root.path(symbol);
            if (!node.isObject() || "error".equals(node.path("status").asText())) {
                log.warn("No quote returned for {}", symbol);
                continue;
            }
            quotes.put(symbol, toQuote(node));
        }
        return quotes;
    }

    private Quote toQuote(JsonNode node) {
        return Quote.builder()
                .symbol(JsonValues.text(node, "symbol"))
                .open(JsonValues.decimal(node, "open"))
                .high(JsonValues.decimal(node, "high"))
                .low(JsonValues.decimal(node, "low"))
                .price(JsonValues.decimal(node, "close"))
                .volume(JsonValues.whole(node, "volume"))
                .previousClose(JsonValues.decimal(node, "previous_close"))
                .change(JsonValues.decimal(node, "change"))
                .changePercent(JsonValues.decimal(node, "percent_change"))
                .latestTradingDay(JsonValues.date(node, "datetime"))
                .build();
    }

    @Override
    public List<InstrumentProfile> search(String query) throws InterruptedException {
        JsonNode data = get("/symbol_search", query, "symbol", query).path("data");
        if (!data.isArray()) {
            return Collections.emptyList();
        }
        List<InstrumentProfile> results = new ArrayList<>();
        for (JsonNode item : data) {
            if (results.size() >= MAX_SEARCH_RESULTS) {
                break;
            }
            String symbol = JsonValues.text(item, "symbol");
            if (symbol == null) {
                continue;
            }
            results.add(InstrumentProfile.builder()
                    .symbol(symbol)
                    .name(JsonValues.text(item, "instrument_name"))
                    .exchange(JsonValues.text(item, "exchange"))
                    .currency(JsonValues.text(item, "currency"))
                    .build());
        }
        return results;
    }

    @Override
    public Optional<InstrumentProfile> getProfile(String symbol) throws InterruptedException {
        JsonNode profile = get("/profile", symbol, "symbol", symbol);
        String name = JsonValues.text(profile, "name");
        if (name == null) {
            return Optional.empty();
        }
        return Optional.of(InstrumentProfile.builder()
                .symbol(Optional.ofNullable(JsonValues.text(profile, "symbol")).orElse(symbol))
                .name(name)
                .exchange(JsonValues.text(profile, "exchange"))
                .sector(JsonValues.text(profile, "sector"))
                .industry(JsonValues.text(profile, "industry"))
                .build());
    }

    private JsonNode get(String path, String subject, String... params) throws InterruptedException {
        gate.acquire();
        try {
            String body = restClient.get()
                    .uri(builder -> {
                        builder.path(path);
                        for (int i = 0; i + 1 < params.length; i += 2) {
                            builder.queryParam(params[i], params[i + 1]);
                        }
                        return builder.queryParam("apikey", apiKey).build();
                    })
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                log.warn("Empty {} response for {}", path, subject);
                return MissingNode.getInstance();
            }
            JsonNode root = objectMapper.readTree(body);
            if ("error".equals(root.path("status").asText())) {
                log.error("Twelve Data {} error for {}: {}", path, subject, root.path("message").asText("Unknown error"));
                return MissingNode.getInstance();
            }
            return root;
        } catch (RestClientException e) {
            log.error("Twelve Data {} request failed for {}: {}", path, subject, e.getMessage());
            return MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            log.error("Twelve Data {} returned malformed JSON for {}: {}", path, subject, e.getMessage());
            return MissingNode.getInstance();
        }
    }
}
