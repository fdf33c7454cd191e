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
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link DataProvider} backed by the Alpha Vantage query API.
 * The free tier admits five calls per minute, so calls are spaced by the gate (12 s by default)
 * and a realtime batch only covers its first {@code maxQuoteBatch} symbols.
 */
@Slf4j
public class AlphaVantageProvider implements DataProvider {

    public static final String NAME = "alphavantage";

    private static final String QUERY_PATH = "/query";
    private static final String DAILY_SERIES = "Time Series (Daily)";
    private static final String GLOBAL_QUOTE = "Global Quote";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final RateLimitGate gate;
    private final int maxQuoteBatch;

    public AlphaVantageProvider(RestClient restClient, ObjectMapper objectMapper, String apiKey,
            RateLimitGate gate, int maxQuoteBatch) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
        this.gate = gate;
        this.maxQuoteBatch = maxQuoteBatch;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<HistoricalBar> fetchHistory(String symbol, LocalDate startDate, LocalDate endDate)
            throws InterruptedException {
        JsonNode root = query(symbol, "TIME_SERIES_DAILY", "symbol", symbol, "outputsize", "full");
        JsonNode series = root.path(DAILY_SERIES);
        if (!series.isObject()) {
            log.warn("No daily series returned for {}", symbol);
            return Collections.emptyList();
        }

        List<HistoricalBar> bars = new ArrayList<>();
        int rejected = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = series.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            LocalDate date;
            try {
                date = LocalDate.parse(entry.getKey());
            } catch (RuntimeException e) {
                log.warn("Skipping unparseable date {} for {}", entry.getKey(), symbol);
                continue;
            }
            if (date.isBefore(startDate) || date.isAfter(endDate)) {
                continue;
            }
            JsonNode values = entry.getValue();
            HistoricalBar bar = HistoricalBar.builder()
                    .date(date)
                    .open(JsonValues.decimal(values, "1. open"))
                    .high(JsonValues.decimal(values, "2. high"))
                    .low(JsonValues.decimal(values, "3. low"))
                    .close(JsonValues.decimal(values, "4. close"))
                    .volume(JsonValues.whole(values, "5. volume"))
                    .adjustedClose(JsonValues.decimal(values, "4. close"))
                    .build();
            if (bar.isValid()) {
                bars.add(bar);
            } else {
                rejected++;
                log.warn("Dropping invalid bar for {} on {}: {}", symbol, date, values);
            }
        }

        bars.sort(Comparator.comparing(HistoricalBar::getDate));
        log.info("Fetched {} bars for {} between {} and {} ({} rejected)", bars.size(), symbol, startDate,
                endDate, rejected);
        return bars;
    }

    @Override
    public Map<String, Quote> fetchRealtimeBatch(Collection<String> symbols) throws InterruptedException {
        Map<String, Quote> quotes = new LinkedHashMap<>();
        int requested = 0;
        for (String symbol : symbols) {
            if (requested++ >= maxQuoteBatch) {
                log.info("Quote batch capped at {} of {} symbols", maxQuoteBatch, symbols.size());
                break;
            }
            JsonNode quote = query(symbol, "GLOBAL_QUOTE", "symbol", symbol).path(GLOBAL_QUOTE);
            if (!quote.isObject() || quote.isEmpty()) {
                log.warn("No quote returned for {}", symbol);
                continue;
            }
            quotes.put(symbol, Quote.builder()
                    .symbol(Optional.ofNullable(JsonValues.text(quote, "01. symbol")).orElse(symbol))
                    .open(JsonValues.decimal(quote, "02. open"))
                    .high(JsonValues.decimal(quote, "03. high"))
                    .low(JsonValues.decimal(quote, "04. low"))
                    .price(JsonValues.decimal(quote, "05. price"))
                    .volume(JsonValues.whole(quote, "06. volume"))
                    .latestTradingDay(JsonValues.date(quote, "07. latest trading day"))
                    .previousClose(JsonValues.decimal(quote, "08. previous close"))
                    .change(JsonValues.decimal(quote, "09. change"))
                    .changePercent(JsonValues.decimal(quote, "10. change percent"))
                    .build());
        }
        return quotes;
    }

    @Override
    public List<InstrumentProfile> search(String query) throws InterruptedException {
        JsonNode matches = query(query, "SYMBOL_SEARCH", "keywords", query).path("bestMatches");
        if (!matches.isArray()) {
            return Collections.emptyList();
        }
        List<InstrumentProfile> results = new ArrayList<>();
        for (JsonNode match : matches) {
            if (results.size() >= MAX_SEARCH_RESULTS) {
                break;
            }
            String symbol = JsonValues.text(match, "1. symbol");
            if (symbol == null) {
                continue;
            }
            results.add(InstrumentProfile.builder()
                    .symbol(symbol)
                    .name(JsonValues.text(match, "2. name"))
                    .exchange(JsonValues.text(match, "4. region"))
                    .currency(JsonValues.text(match, "8. currency"))
                    .build());
        }
        return results;
    }

    @Override
    public Optional<InstrumentProfile> getProfile(String symbol) throws InterruptedException {
        JsonNode overview = query(symbol, "OVERVIEW", "symbol", symbol);
        String name = JsonValues.text(overview, "Name");
        if (name == null) {
            return Optional.empty();
        }
        return Optional.of(InstrumentProfile.builder()
                .symbol(Optional.ofNullable(JsonValues.text(overview, "Symbol")).orElse(symbol))
                .name(name)
                .exchange(JsonValues.text(overview, "Exchange"))
                .sector(JsonValues.text(overview, "Sector"))
                .industry(JsonValues.text(overview, "Industry"))
                .currency(JsonValues.text(overview, "Currency"))
                .marketCap(JsonValues.real(overview, "MarketCapitalization"))
                .build());
    }

    /**
     * Issue one rate-limited query and parse the body. Transport, parse and vendor-level
     * errors yield a missing node.
     */
    private JsonNode query(String subject, String function, String... params) throws InterruptedException {
        gate.acquire();
        try {
            String body = restClient.get()
                    .uri(builder -> {
                        builder.path(QUERY_PATH).queryParam("function", function);
                        for (int i = 0; i + 1 < params.length; i += 2) {
                            builder.queryParam(params[i], params[i + 1]);
                        }
                        return builder.queryParam("apikey", apiKey).build();
                    })
                    .retrieve()
                    .body(String.class);
            if (body == null || body.isBlank()) {
                log.warn("Empty {} response for {}", function, subject);
                return MissingNode.getInstance();
            }
            JsonNode root = objectMapper.readTree(body);
            if (root.has("Error Message")) {
                log.error("Alpha Vantage {} error for {}: {}", function, subject, root.path("Error Message").asText());
                return MissingNode.getInstance();
            }
            for (String notice : new String[] { "Note", "Information" }) {
                if (root.has(notice)) {
                    log.warn("Alpha Vantage {} notice for {}: {}", function, subject, root.path(notice).asText());
                    return MissingNode.getInstance();
                }
            }
            return root;
        } catch (RestClientException e) {
            log.error("Alpha Vantage {} request failed for {}: {}", function, subject, e.getMessage());
            return MissingNode.getInstance();
        } catch (JsonProcessingException e) {
            log.error("Alpha Vantage {} returned malformed JSON for {}: {}", function, subject, e.getMessage());
            return MissingNode.getInstance();
        }
    }
}
