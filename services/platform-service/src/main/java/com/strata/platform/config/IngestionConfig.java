package com.strata.platform.config;

import com.strata.tabular.TabularParser;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class IngestionConfig {

    @Bean
    public TabularParser tabularParser() {
        return new TabularParser();
    }
}
