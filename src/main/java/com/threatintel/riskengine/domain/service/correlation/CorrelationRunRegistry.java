package com.threatintel.riskengine.domain.service.correlation;

import com.threatintel.riskengine.domain.model.CorrelationWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-scoped lock keyed by window. A run may only start when no active run covers an
 * overlapping time range; a conflicting request fails immediately instead of waiting.
 */
@Slf4j
@Component
public class CorrelationRunRegistry {

    private final List<RunLease> active = new ArrayList<>();

    public synchronized RunLease acquire(CorrelationWindow window) {
        for (RunLease lease : active) {
            if (lease.window.overlaps(window)) {
                throw new CorrelationRunInProgressException(window, lease.window);
            }
        }
        RunLease lease = new RunLease(window);
        active.add(lease);
        return lease;
    }

    /**
     * Flags every active run overlapping {@code window} for cancellation. The runs stop at
     * their next phase boundary, before anything is written.
     */
    public synchronized int cancelOverlapping(CorrelationWindow window) {
        int cancelled = 0;
        for (RunLease lease : active) {
            if (lease.window.overlaps(window) && lease.cancelled.compareAndSet(false, true)) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("[Correlation] cancellation requested: window={}..{}, runs={}",
                    window.start(), window.end(), cancelled);
        }
        return cancelled;
    }

    public synchronized List<CorrelationWindow> activeWindows() {
        return active.stream().map(RunLease::window).toList();
    }

    private synchronized void release(RunLease lease) {
        active.remove(lease);
    }

    public final class RunLease implements AutoCloseable {

        private final CorrelationWindow window;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);

        private RunLease(CorrelationWindow window) {
            this.window = window;
        }

        public CorrelationWindow window() {
            return window;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        @Override
        public void close() {
            release(this);
        }
    }
}
