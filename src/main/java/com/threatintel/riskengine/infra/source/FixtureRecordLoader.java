package com.threatintel.riskengine.infra.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.service.correlation.CorrelationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads a JSON array of records into the in-memory source at startup when enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FixtureRecordLoader {

    private static final TypeReference<List<SignalRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final CorrelationProperties properties;
    private final InMemoryRecordSource recordSource;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        if (!properties.getFixtures().isEnabled()) return;
        int loaded = load(properties.getFixtures().getLocation());
        log.info("[Fixtures] loaded {} records from {}", loaded, properties.getFixtures().getLocation());
    }

    public int load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("fixture not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return recordSource.addAll(objectMapper.readValue(in, RECORD_LIST));
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read fixture " + location, e);
        }
    }
}
