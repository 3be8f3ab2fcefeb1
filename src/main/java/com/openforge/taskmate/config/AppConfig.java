package com.openforge.taskmate.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Core infrastructure beans:
 *  - Java HttpClient  → the only HTTP engine used for LLM calls
 *  - Jackson mapper   → snake_case on the wire (HTTP bodies, stored tool
 *                       arguments/results, LLM payloads), ISO-8601 dates,
 *                       unknown properties ignored
 *
 * Scheduling is enabled for the abandoned-proposal sweep.
 */
@Configuration
@EnableScheduling
public class AppConfig {

    /** Shared client; per-request read timeouts are set by LlmClient. */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
