package com.uwb.positioning.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Configuration for the WebClient used to forward stored readings downstream.
 */
@Configuration
@RequiredArgsConstructor
public class WebClientConfig {

    private final UwbProperties properties;

    /**
     * Creates a WebClient bounded by the forwarding timeouts. Built from the Boot-managed builder
     * so request bodies use the application's Jackson settings.
     *
     * @param builder auto-configured WebClient builder
     * @return Configured WebClient instance
     */
    @Bean
    public WebClient forwardingWebClient(WebClient.Builder builder) {
        UwbProperties.Forwarding forwarding = properties.getForwarding();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) forwarding.getConnectTimeoutMs())
            .responseTimeout(Duration.ofMillis(forwarding.getReadTimeoutMs()))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(
                    forwarding.getReadTimeoutMs(), TimeUnit.MILLISECONDS))
            );

        return builder
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
