package com.example.mailtriage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {
    @Bean
    public WebClient googleGenerativeClient(WebClient.Builder builder, TriageProperties properties) {
        TriageProperties.Llm llm = properties.getLlm();
        ExchangeStrategies strategies = ExchangeStrategies.builder()
                .codecs(configurer -> configurer
                        .defaultCodecs()
                        .maxInMemorySize(llm.getMaxInMemorySize()))
                .build();

        // socket guard only, triage.llm.timeout is enforced by the pipeline
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(llm.getTimeout().multipliedBy(2));

        return builder
                .baseUrl(llm.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .exchangeStrategies(strategies)
                .build();
    }
}
