package com.clapgrow.mediarelay.worker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class WebClientConfig {
    
    @Bean
    public WebClient engineWebClient(RelayProperties properties) {
        return WebClient.builder()
            .baseUrl(properties.getEngine().getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs()
                .maxInMemorySize(properties.getEngine().getMaxInMemorySize()))
            .build();
    }
}
