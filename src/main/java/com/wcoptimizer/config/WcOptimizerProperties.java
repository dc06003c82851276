package com.wcoptimizer.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Explicit configuration for the analytics engine. Store locations and every
 * policy default live here and are injected at construction; nothing reads
 * process environment at call time.
 */
@Data
@ConfigurationProperties(prefix = "wc")
public class WcOptimizerProperties {

    private Tabular tabular = new Tabular();
    private Graph graph = new Graph();
    private Policy policy = new Policy();
    private Query query = new Query();

    @Data
    public static class Tabular {
        private String url = "jdbc:duckdb:./data/supply_chain.duckdb";
    }

    @Data
    public static class Graph {
        private String uri = "bolt://localhost:7687";
        private String username = "neo4j";
        private String password = "neo4j";
        private String database;
        private Duration connectionTimeout = Duration.ofSeconds(5);
        private Duration maxRetryTime = Duration.ZERO;
    }

    @Data
    public static class Policy {
        private double defaultUnitCost = 10.0;
        private int defaultLeadTimeDays = 14;
        private double defaultDemandStdDev = 50.0;
        private int defaultOrderQuantity = 100;
        private int deadStockDays = 90;
        private int stockoutHorizonDays = 14;
        private double fallbackAnnualRevenue = 100_000_000.0;
    }

    @Data
    public static class Query {
        private int maxRows = 100;
        private int maxSkusPerCall = 20;
    }
}
