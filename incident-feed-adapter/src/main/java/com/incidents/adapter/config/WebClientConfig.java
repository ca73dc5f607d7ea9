package com.incidents.adapter.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    private final IncidentProperties properties;

    public WebClientConfig(IncidentProperties properties) {
        this.properties = properties;
    }

    @Bean
    public WebClient geocoderWebClient() {
        IncidentProperties.Geocoder geocoder = properties.getGeocoder();
        long timeoutSeconds = Math.max(1, geocoder.getTimeout().toSeconds());

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5000)
                .responseTimeout(geocoder.getTimeout())
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );

        // Nominatim usage policy requires an identifying User-Agent
        return WebClient.builder()
                .baseUrl(geocoder.getBaseUrl())
                .defaultHeader(HttpHeaders.USER_AGENT, geocoder.getUserAgent())
                .defaultHeader(HttpHeaders.ACCEPT_LANGUAGE, geocoder.getAcceptLanguage())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
