package com.wcoptimizer.config;

import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Config;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.time.Clock;
import java.util.concurrent.TimeUnit;

@Slf4j
@Configuration
public class StoreConfig {

    @Bean
    public DataSource tabularDataSource(WcOptimizerProperties properties) {
        return new DuckDbDataSource(properties.getTabular().getUrl());
    }

    /**
     * The driver connects lazily, so an absent graph server does not stop the
     * application; graph-backed analyses fall back to tabular data instead.
     */
    @Bean(destroyMethod = "close")
    public Driver graphDriver(WcOptimizerProperties properties) {
        WcOptimizerProperties.Graph graph = properties.getGraph();
        Config config = Config.builder()
            .withConnectionTimeout(graph.getConnectionTimeout().toMillis(), TimeUnit.MILLISECONDS)
            .withMaxTransactionRetryTime(graph.getMaxRetryTime().toMillis(), TimeUnit.MILLISECONDS)
            .build();
        log.info("Graph driver configured → {}", graph.getUri());
        return GraphDatabase.driver(graph.getUri(),
            AuthTokens.basic(graph.getUsername(), graph.getPassword()), config);
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
