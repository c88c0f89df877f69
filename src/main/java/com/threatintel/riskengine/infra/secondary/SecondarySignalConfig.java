package com.threatintel.riskengine.infra.secondary;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.riskengine.domain.port.SecondarySeveritySignal;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class SecondarySignalConfig {

    @Bean
    public SecondarySeveritySignal secondarySeveritySignal(SecondarySignalProperties properties,
                                                           OkHttpClient okHttpClient,
                                                           ObjectMapper objectMapper) {
        if (!properties.isEnabled()) {
            log.info("[Secondary] secondary severity signal disabled, disagreement monitoring uses record labels only");
            return SecondarySeveritySignal.NONE;
        }
        log.info("[Secondary] secondary severity signal enabled: baseUrl={}", properties.getBaseUrl());
        return new HttpSecondarySeveritySignal(okHttpClient, properties, objectMapper);
    }
}
