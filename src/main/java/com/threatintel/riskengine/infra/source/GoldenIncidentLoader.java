package com.threatintel.riskengine.infra.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.riskengine.domain.service.evaluation.GoldenIncident;
import com.threatintel.riskengine.domain.service.scoring.ScoringProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads the golden incident set used by the scoring backtest.
 */
@Component
@RequiredArgsConstructor
public class GoldenIncidentLoader {

    private static final TypeReference<List<GoldenIncident>> INCIDENT_LIST = new TypeReference<>() {
    };

    private final ScoringProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public List<GoldenIncident> loadDefault() {
        return load(properties.getBacktest().getDatasetLocation());
    }

    public List<GoldenIncident> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("golden dataset not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            return objectMapper.readValue(in, INCIDENT_LIST);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read golden dataset " + location, e);
        }
    }
}
