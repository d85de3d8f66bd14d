package com.studioledger.backup.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * HTTP clients for Google APIs. Read timeout is generous because archive
 * uploads and downloads go through the same template.
 */
@Configuration
public class HttpClientConfig {

    @Bean(name = "googleRestTemplate")
    public RestTemplate googleRestTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(15))
                .setReadTimeout(Duration.ofMinutes(30))
                .build();
    }
}
