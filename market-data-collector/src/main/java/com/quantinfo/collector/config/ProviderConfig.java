package com.quantinfo.collector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quantinfo.collector.provider.AlphaVantageProvider;
import com.quantinfo.collector.provider.DataProvider;
import com.quantinfo.collector.provider.RateLimitGate;
import com.quantinfo.collector.provider.TwelveDataProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * Builds the active {@link DataProvider} from {@code market-data.*} properties.
 * A missing API key or an unknown provider id fails startup.
 */
@Configuration
@Slf4j
public class ProviderConfig {

    @Value("${market-data.provider:alphavantage}")
    private String providerName;

    @Value("${market-data.http.connect-timeout:10s}")
    private Duration connectTimeout;

    @Value("${market-data.http.read-timeout:30s}")
    private Duration readTimeout;

    @Value("${market-data.alphavantage.base-url:https://www.alphavantage.co}")
    private String alphaVantageBaseUrl;

    @Value("${market-data.alphavantage.api-key:}")
    private String alphaVantageApiKey;

    @Value("${market-data.alphavantage.min-interval:12s}")
    private Duration alphaVantageInterval;

    @Value("${market-data.alphavantage.max-quote-batch:3}")
    private int alphaVantageMaxQuoteBatch;

    @Value("${market-data.twelvedata.base-url:https://api.twelvedata.com}")
    private String twelveDataBaseUrl;

    @Value("${market-data.twelvedata.api-key:}")
    private String twelveDataApiKey;

    @Value("${market-data.twelvedata.min-interval:2s}")
    private Duration twelveDataInterval;

    @Bean
    public DataProvider dataProvider(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        String provider = providerName.trim().toLowerCase();
        switch (provider) {
            case AlphaVantageProvider.NAME:
                log.info("Using Alpha Vantage provider at {} (min interval {})", alphaVantageBaseUrl, alphaVantageInterval);
                return new AlphaVantageProvider(
                        restClient(restClientBuilder, alphaVantageBaseUrl),
                        objectMapper,
                        requireKey("market-data.alphavantage.api-key", alphaVantageApiKey),
                        new RateLimitGate(alphaVantageInterval),
                        alphaVantageMaxQuoteBatch);
            case TwelveDataProvider.NAME:
                log.info("Using Twelve Data provider at {} (min interval {})", twelveDataBaseUrl, twelveDataInterval);
                return new TwelveDataProvider(
                        restClient(restClientBuilder, twelveDataBaseUrl),
                        objectMapper,
                        requireKey("market-data.twelvedata.api-key", twelveDataApiKey),
                        new RateLimitGate(twelveDataInterval));
            default:
                throw new IllegalStateException("Unknown market-data.provider: " + providerName);
        }
    }

    private RestClient restClient(RestClient.Builder builder, String baseUrl) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) connectTimeout.toMillis());
        requestFactory.setReadTimeout((int) readTimeout.toMillis());
        return builder
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, "QuantInfo-Collector/1.0")
                .defaultHeader(HttpHeaders.ACCEPT, "application/json")
                .build();
    }

    private static String requireKey(String property, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(property + " must be configured");
        }
        return value;
    }
}
