package com.threatintel.riskengine.infra.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class CorrelationMetrics {

    private final Timer runTimer;
    private final Counter runsRejected;
    private final Counter runsAborted;
    private final Counter threadsEmitted;
    private final Counter recordsSkipped;
    private final Counter disagreementsRecorded;
    private final Counter secondarySignalFailures;

    public CorrelationMetrics(MeterRegistry meterRegistry) {
        this.runTimer = Timer.builder("correlation.run.duration")
                .description("Correlation run duration, read to write")
                .register(meterRegistry);
        this.runsRejected = Counter.builder("correlation.run.rejected")
                .description("Runs rejected because an overlapping window was in progress")
                .register(meterRegistry);
        this.runsAborted = Counter.builder("correlation.run.aborted")
                .description("Runs cancelled before the result write")
                .register(meterRegistry);
        this.threadsEmitted = Counter.builder("correlation.threads.emitted")
                .register(meterRegistry);
        this.recordsSkipped = Counter.builder("correlation.records.skipped")
                .description("Records kept out of clustering for missing timestamp or pivots")
                .register(meterRegistry);
        this.disagreementsRecorded = Counter.builder("disagreement.records.inserted")
                .register(meterRegistry);
        this.secondarySignalFailures = Counter.builder("secondary.signal.failures")
                .description("Secondary severity lookups that failed and were treated as absent")
                .register(meterRegistry);
    }

    public void recordRun(Duration elapsed, int threads, int skipped) {
        runTimer.record(elapsed);
        threadsEmitted.increment(threads);
        recordsSkipped.increment(skipped);
    }

    public void runRejected() {
        runsRejected.increment();
    }

    public void runAborted() {
        runsAborted.increment();
    }

    public void disagreementsInserted(int count) {
        disagreementsRecorded.increment(count);
    }

    public void secondarySignalFailed() {
        secondarySignalFailures.increment();
    }
}
