package org.stellarcalendar.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.io.HttpClientConnectionManager;
import org.apache.hc.core5.util.Timeout;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP client used for all outbound federation traffic.
 * Only {@link org.stellarcalendar.service.SafeHttpClient} talks to it.
 */
@Configuration
@Slf4j
public class FederationHttpConfiguration {

    /**
     * Pooled Apache HttpClient with redirects disabled and every phase bounded by the same timeout.
     * Redirects stay off so a safe URL cannot bounce the request to an internal address.
     * The same timeout is also the deadline for the whole exchange.
     */
    @Bean
    public DeadlineClientHttpRequestFactory federationRequestFactory(
        @Value("${stellar.activitypub.http-timeout:30s}") Duration httpTimeout,
        @Value("${stellar.activitypub.max-connections:50}") int maxConnections
    ) {
        Timeout timeout = Timeout.ofMilliseconds(httpTimeout.toMillis());

        HttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
            .setMaxConnTotal(maxConnections)
            .setMaxConnPerRoute(Math.max(1, maxConnections / 5))
            .setDefaultConnectionConfig(ConnectionConfig.custom()
                .setConnectTimeout(timeout)
                .setSocketTimeout(timeout)
                .build())
            .build();

        HttpClient httpClient = HttpClientBuilder.create()
            .setConnectionManager(connectionManager)
            .setDefaultRequestConfig(RequestConfig.custom()
                .setConnectionRequestTimeout(timeout)
                .setResponseTimeout(timeout)
                .build())
            .disableRedirectHandling()
            .build();

        log.info("Initialized federation HTTP client: timeout={}, maxConnections={}", httpTimeout, maxConnections);

        return new DeadlineClientHttpRequestFactory(httpClient, httpTimeout);
    }

    @Bean
    public RestTemplate federationRestTemplate(DeadlineClientHttpRequestFactory federationRequestFactory) {
        return new RestTemplate(federationRequestFactory);
    }
}
