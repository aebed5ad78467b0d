package com.example.syncengine.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient instances for outbound calls. Each has its own timeouts.
 */
@Configuration
public class WebClientConfig {

    /**
     * Provider ingestion gateway (mail, calendar, drive import and processing).
     *
     * Timeout: 60 seconds (a full import page can be slow)
     */
    @Bean("providerWebClient")
    public WebClient providerWebClient(@Value("${sync.provider.base-url:http://localhost:8090}") String baseUrl,
                                       @Value("${sync.provider.timeout-seconds:60}") int timeoutSeconds) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient(10_000, timeoutSeconds)))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024)) // 16MB
                .build();
    }

    /**
     * OAuth token endpoint.
     *
     * Timeout: 15 seconds
     */
    @Bean("oauthWebClient")
    public WebClient oauthWebClient() {
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient(5_000, 15)))
                .build();
    }

    private static HttpClient httpClient(int connectTimeoutMillis, int timeoutSeconds) {
        return HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));
    }
}
