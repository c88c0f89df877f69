package com.threatintel.riskengine.domain.service.correlation;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Periodic correlation over the trailing lookback window.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "correlation.schedule", name = "enabled", havingValue = "true")
public class CorrelationScheduler {

    private final CorrelationService correlationService;
    private final CorrelationProperties properties;

    @Scheduled(cron = "${correlation.schedule.cron:0 0 * * * *}")
    public void correlateTrailingWindow() {
        Instant end = Instant.now().truncatedTo(ChronoUnit.MINUTES);
        long lookbackMinutes = Math.round(properties.getSchedule().getLookbackHours() * 60.0);
        Instant start = end.minus(Duration.ofMinutes(lookbackMinutes));

        try {
            correlationService.correlate(start, end, null, null);
        } catch (CorrelationRunInProgressException e) {
            log.info("[Correlation-Schedule] skipped, overlapping run still active: {}", e.getMessage());
        } catch (CorrelationRunAbortedException e) {
            log.info("[Correlation-Schedule] run cancelled: {}", e.getMessage());
        }
    }
}
