package com.oddsfeed.infrastructure.config;

import com.oddsfeed.domain.ports.OddsGateway;
import com.oddsfeed.domain.ports.OddsPayloadNormalizer;
import com.oddsfeed.infrastructure.scraper.HttpTransport;
import com.oddsfeed.infrastructure.scraper.PooledHttpTransport;
import com.oddsfeed.infrastructure.scraper.Sleeper;
import com.oddsfeed.infrastructure.scraper.livesport.LivesportOddsClient;
import com.oddsfeed.infrastructure.scraper.livesport.LivesportPayloadNormalizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Upstream client wiring. The connection pool and the fetch workers are
 * created once here and released when the context shuts down.
 */
@Configuration
@EnableConfigurationProperties(OddsUpstreamProperties.class)
public class OddsClientConfig {

    @Bean
    public Clock oddsClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public HttpTransport oddsHttpTransport(OddsUpstreamProperties properties) {
        return new PooledHttpTransport(
            properties.connectTimeout(),
            properties.responseTimeout(),
            properties.maxConnections());
    }

    @Bean
    public OddsGateway livesportOddsClient(HttpTransport oddsHttpTransport, OddsUpstreamProperties properties, Clock oddsClock) {
        return new LivesportOddsClient(oddsHttpTransport, properties, oddsClock, Sleeper.THREAD);
    }

    @Bean
    public OddsPayloadNormalizer oddsPayloadNormalizer(OddsUpstreamProperties properties, Clock oddsClock) {
        return new LivesportPayloadNormalizer(oddsClock, properties.source());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService oddsFetchExecutor(OddsUpstreamProperties properties) {
        return Executors.newFixedThreadPool(properties.maxConnections());
    }
}
