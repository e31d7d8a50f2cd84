package com.nestegg.backend.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class MarketDataHttpConfig {

    @Bean
    public RestTemplate marketDataRestTemplate(
            @Value("${market-data.http.connect-timeout-ms:5000}") int connectTimeoutMs,
            @Value("${market-data.http.read-timeout-ms:8000}") int readTimeoutMs
    ) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
