package com.example.mailmerge.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration
public class WebClientConfig {

    @Bean
    public WebClient gmailWebClient(WebClient.Builder builder,
                                    @Value("${google.gmail-base-url:https://gmail.googleapis.com/gmail/v1/users/me}") String baseUrl,
                                    @Value("${mailmerge.transport.timeout:60s}") Duration timeout) {
        // Request bodies carry every attachment base64 encoded; responses stay small
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(1024 * 1024))
                .build();

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(timeout);

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }

    @Bean
    public WebClient googleOauthClient(WebClient.Builder builder,
                                       @Value("${google.oauth-base-url:https://oauth2.googleapis.com}") String baseUrl,
                                       @Value("${mailmerge.transport.timeout:60s}") Duration timeout) {
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(timeout);

        return builder.clone()
                .baseUrl(baseUrl)
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
