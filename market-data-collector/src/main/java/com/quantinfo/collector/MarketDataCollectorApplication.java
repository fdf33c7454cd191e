package com.quantinfo.collector;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Market Data Collector service.
 * Ingests daily price history, derives technical indicators and serves rankings.
 */
@SpringBootApplication
public class MarketDataCollectorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketDataCollectorApplication.class, args);
    }

}
