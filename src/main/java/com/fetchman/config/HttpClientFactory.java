package com.fetchman.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.netty.channel.ChannelOption;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * A Spring configuration class responsible for creating the outbound HTTP client beans.
 * <p>
 * The client performs exactly one attempt per execution: there is no retry filter.
 * Instead every call is bounded by a {@link TimeLimiter} so that a slow target cannot hold
 * resources indefinitely.
 */
@Configuration
public class HttpClientFactory {

    public static final String OUTBOUND_TIME_LIMITER = "fetchman-outbound";

    /**
     * Creates the WebClient used for user-initiated executions.
     * <p>
     * Redirects are not followed so that the caller sees the status the target actually returned,
     * and the codec buffer is raised to the configured response ceiling because bodies are read
     * fully into memory.
     *
     * @param properties Fetchman settings.
     * @return A configured {@link WebClient}.
     */
    @Bean
    public WebClient webClient(FetchmanProperties properties) {
        FetchmanProperties.Http http = properties.getHttp();
        HttpClient httpClient = HttpClient.create()
                .followRedirect(false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) http.getConnectTimeout().toMillis());

        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize((int) http.getMaxResponseBytes().toBytes()))
                .build();

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    /**
     * The time limiter applied to the whole outbound exchange, body read included.
     */
    @Bean
    public TimeLimiter outboundTimeLimiter(FetchmanProperties properties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(properties.getHttp().getTimeout())
                .cancelRunningFuture(true)
                .build();
        return TimeLimiterRegistry.of(config).timeLimiter(OUTBOUND_TIME_LIMITER);
    }
}
