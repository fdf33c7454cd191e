package com.quantinfo.collector.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Tests for Alpha Vantage payload parsing against a mocked HTTP server.
 */
class AlphaVantageProviderTest {

    private MockRestServiceServer server;
    private AlphaVantageProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://www.alphavantage.co");
        server = MockRestServiceServer.bindTo(builder).build();
        provider = new AlphaVantageProvider(builder.build(), new ObjectMapper(), "test-key",
                new RateLimitGate(Duration.ZERO), 3);
    }

    @Test
    void testFetchHistory_FiltersWindowDropsInvalidAndSorts() throws Exception {
        // Arrange
        String body = "{\"Meta Data\":{},\"Time Series (Daily)\":{"
                + "\"2024-01-05\":{\"1. open\":\"181.99\",\"2. high\":\"182.76\",\"3. low\":\"180.17\",\"4. close\":\"181.18\",\"5. volume\":\"62303300\"},"
                + "\"2024-01-03\":{\"1. open\":\"184.22\",\"2. high\":\"185.88\",\"3. low\":\"183.43\",\"4. close\":\"184.25\",\"5. volume\":\"58414500\"},"
                + "\"2024-01-04\":{\"1. open\":\"182.15\",\"2. high\":\"181.00\",\"3. low\":\"180.93\",\"4. close\":\"181.91\",\"5. volume\":\"71983600\"},"
                + "\"2023-12-29\":{\"1. open\":\"193.90\",\"2. high\":\"194.40\",\"3. low\":\"191.73\",\"4. close\":\"192.53\",\"5. volume\":\"42628800\"}"
                + "}}";
        server.expect(requestTo(containsString("function=TIME_SERIES_DAILY")))
                .andExpect(method(HttpMethod.GET))
                .andExpect(requestTo(containsString("outputsize=full")))
                .andExpect(requestTo(containsString("apikey=test-key")))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // Act
        List<HistoricalBar> bars = provider.fetchHistory("AAPL", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        // Assert - 2023-12-29 outside window, 2024-01-04 has high below open
        server.verify();
        assertEquals(2, bars.size());
        assertEquals(LocalDate.of(2024, 1, 3), bars.get(0).getDate());
        assertEquals(LocalDate.of(2024, 1, 5), bars.get(1).getDate());
        assertEquals(new BigDecimal("184.25"), bars.get(0).getClose());
        assertEquals(58414500L, bars.get(0).getVolume());
    }

    @Test
    void testFetchHistory_RateLimitNote_ReturnsEmpty() throws Exception {
        server.expect(requestTo(containsString("function=TIME_SERIES_DAILY")))
                .andRespond(withSuccess("{\"Note\":\"Thank you for using Alpha Vantage! Our standard API call frequency is 5 calls per minute\"}",
                        MediaType.APPLICATION_JSON));

        List<HistoricalBar> bars = provider.fetchHistory("AAPL", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertTrue(bars.isEmpty());
    }

    @Test
    void testFetchHistory_ServerError_ReturnsEmpty() throws Exception {
        server.expect(requestTo(containsString("function=TIME_SERIES_DAILY"))).andRespond(withServerError());

        List<HistoricalBar> bars = provider.fetchHistory("AAPL", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertTrue(bars.isEmpty());
    }

    @Test
    void testFetchHistory_MalformedJson_ReturnsEmpty() throws Exception {
        server.expect(requestTo(containsString("function=TIME_SERIES_DAILY")))
                .andRespond(withSuccess("{not json", MediaType.APPLICATION_JSON));

        List<HistoricalBar> bars = provider.fetchHistory("AAPL", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        assertTrue(bars.isEmpty());
    }

    @Test
    void testFetchRealtimeBatch_CapsBatchAndMapsBlankFieldsToNull() throws Exception {
        // Arrange
        for (String symbol : List.of("AAPL", "MSFT", "NVDA")) {
            String body = "{\"Global Quote\":{\"01. symbol\":\"" + symbol + "\",\"02. open\":\"100.00\","
                    + "\"03. high\":\"101.00\",\"04. low\":\"99.00\",\"05. price\":\"100.50\",\"06. volume\":\"1000\","
                    + "\"07. latest trading day\":\"2024-01-05\",\"08. previous close\":\"--\","
                    + "\"09. change\":\"0.50\",\"10. change percent\":\"0.5000%\"}}";
            server.expect(requestTo(containsString("symbol=" + symbol)))
                    .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));
        }

        // Act
        Map<String, Quote> quotes = provider.fetchRealtimeBatch(List.of("AAPL", "MSFT", "NVDA", "META"));

        // Assert
        server.verify();
        assertEquals(3, quotes.size());
        assertFalse(quotes.containsKey("META"));
        Quote quote = quotes.get("AAPL");
        assertEquals(new BigDecimal("100.50"), quote.getPrice());
        assertNull(quote.getPreviousClose());
        assertEquals(new BigDecimal("0.5000"), quote.getChangePercent());
        assertEquals(LocalDate.of(2024, 1, 5), quote.getLatestTradingDay());
    }

    @Test
    void testSearch_MapsBestMatches() throws Exception {
        server.expect(requestTo(containsString("function=SYMBOL_SEARCH")))
                .andExpect(requestTo(containsString("keywords=apple")))
                .andRespond(withSuccess("{\"bestMatches\":[{\"1. symbol\":\"AAPL\",\"2. name\":\"Apple Inc\","
                        + "\"3. type\":\"Equity\",\"4. region\":\"United States\",\"8. currency\":\"USD\"}]}",
                        MediaType.APPLICATION_JSON));

        List<InstrumentProfile> results = provider.search("apple");

        assertEquals(1, results.size());
        assertEquals("AAPL", results.get(0).getSymbol());
        assertEquals("Apple Inc", results.get(0).getName());
        assertEquals("United States", results.get(0).getExchange());
        assertEquals("USD", results.get(0).getCurrency());
    }

    @Test
    void testGetProfile_NoneMarketCap_MapsToNull() throws Exception {
        server.expect(requestTo(containsString("function=OVERVIEW")))
                .andRespond(withSuccess("{\"Symbol\":\"AAPL\",\"Name\":\"Apple Inc\",\"Exchange\":\"NASDAQ\","
                        + "\"Sector\":\"TECHNOLOGY\",\"Industry\":\"ELECTRONIC COMPUTERS\",\"MarketCapitalization\":\"None\"}",
                        MediaType.APPLICATION_JSON));

        Optional<InstrumentProfile> profile = provider.getProfile("AAPL");

        assertTrue(profile.isPresent());
        assertEquals("TECHNOLOGY", profile.get().getSector());
        assertNull(profile.get().getMarketCap());
    }

    @Test
    void testGetProfile_EmptyObject_ReturnsEmpty() throws Exception {
        server.expect(requestTo(containsString("function=OVERVIEW")))
                .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertTrue(provider.getProfile("ZZZZ").isEmpty());
    }
}
