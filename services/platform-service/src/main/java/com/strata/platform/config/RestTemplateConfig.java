package com.strata.platform.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client for the training service.
 */
@Configuration
public class RestTemplateConfig {

    public static final String TRAINING_REST_TEMPLATE = "trainingRestTemplate";

    @Bean(name = TRAINING_REST_TEMPLATE)
    public RestTemplate trainingRestTemplate(RestTemplateBuilder builder, StrataProperties properties) {
        StrataProperties.Training training = properties.training();
        return builder
                .rootUri(training.baseUrl())
                .setConnectTimeout(training.connectTimeout())
                .setReadTimeout(training.readTimeout())
                .build();
    }
}
