package com.ai.trialmatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Outbound HTTP clients. Every call is bounded so a stalled upstream cannot pin a session lock.
 */
@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate clinicalTrialsRestTemplate(
            RestTemplateBuilder builder,
            @Value("${clinicaltrials.connect-timeout:5s}") Duration connectTimeout,
            @Value("${clinicaltrials.read-timeout:10s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }

    @Bean
    public RestTemplate nlpModelRestTemplate(
            RestTemplateBuilder builder,
            @Value("${nlp.model.connect-timeout:2s}") Duration connectTimeout,
            @Value("${nlp.model.read-timeout:5s}") Duration readTimeout) {
        return builder
                .setConnectTimeout(connectTimeout)
                .setReadTimeout(readTimeout)
                .build();
    }
}
