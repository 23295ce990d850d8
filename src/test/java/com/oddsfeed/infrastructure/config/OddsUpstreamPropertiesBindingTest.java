package com.oddsfeed.infrastructure.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class OddsUpstreamPropertiesBindingTest {

    private final ApplicationContextRunner contextRunner =
        new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

    @Test
    void bindsConfiguredValues() {
        contextRunner
            .withPropertyValues(
                "odds.upstream.base-url=http://localhost:9000/odds",
                "odds.upstream.geo-ip-code=SK",
                "odds.upstream.max-retries=5",
                "odds.upstream.backoff-factor=250ms",
                "odds.upstream.cache-ttl=0s",
                "odds.upstream.request-timeout=2s",
                "odds.upstream.headers[X-Client]=odds-feed")
            .run(context -> {
                assertThat(context).hasNotFailed();
                OddsUpstreamProperties properties = context.getBean(OddsUpstreamProperties.class);

                assertThat(properties.baseUrl()).isEqualTo("http://localhost:9000/odds");
                assertThat(properties.geoIpCode()).isEqualTo("SK");
                assertThat(properties.geoIpSubdivisionCode()).isEqualTo("CZ10");
                assertThat(properties.maxRetries()).isEqualTo(5);
                assertThat(properties.backoffFactor()).isEqualTo(Duration.ofMillis(250));
                assertThat(properties.requestTimeout()).isEqualTo(Duration.ofSeconds(2));
                assertThat(properties.cachingEnabled()).isFalse();
                assertThat(properties.headers()).containsEntry("X-Client", "odds-feed");
            });
    }

    @Test
    void fallsBackToDefaults() {
        contextRunner
            .withPropertyValues("odds.upstream.max-retries=-2")
            .run(context -> {
                assertThat(context).hasNotFailed();
                OddsUpstreamProperties properties = context.getBean(OddsUpstreamProperties.class);

                assertThat(properties.baseUrl()).isEqualTo("https://global.ds.lsapp.eu/odds/pq_graphql");
                assertThat(properties.hash()).isEqualTo("oce");
                assertThat(properties.maxRetries()).isZero();
                assertThat(properties.cacheTtl()).isEqualTo(Duration.ofSeconds(30));
                assertThat(properties.maxBackoff()).isEqualTo(Duration.ofSeconds(10));
                assertThat(properties.headers()).isEqualTo(OddsUpstreamProperties.DEFAULT_HEADERS);
                assertThat(properties.source()).isEqualTo("livesport");
            });
    }

    @Configuration
    @EnableConfigurationProperties(OddsUpstreamProperties.class)
    static class TestConfiguration {
    }
}
