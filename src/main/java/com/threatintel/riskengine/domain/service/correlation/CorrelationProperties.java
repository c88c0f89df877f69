package com.threatintel.riskengine.domain.service.correlation;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "correlation")
public class CorrelationProperties {

    private double defaultWindowHours = 72.0;
    private int defaultMinClusterSize = 2;
    private long tightTemporalMinutes = 60;
    private int scoringThreads = 4;

    private Schedule schedule = new Schedule();
    private Fixtures fixtures = new Fixtures();

    @Getter
    @Setter
    public static class Schedule {
        private boolean enabled = false;
        private String cron = "0 0 * * * *";
        private double lookbackHours = 168.0;
    }

    @Getter
    @Setter
    public static class Fixtures {
        private boolean enabled = false;
        private String location = "classpath:fixtures/demo-records.json";
    }
}
