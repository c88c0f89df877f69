package com.threatintel.riskengine.domain.service.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.CorrelationWindow;
import com.threatintel.riskengine.domain.model.ThreadSnapshotRecord;
import com.threatintel.riskengine.domain.repository.ThreadSnapshotRepository;
import com.threatintel.riskengine.domain.service.correlation.ThreadNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Read side of the stored thread sets.
 */
@Service
@RequiredArgsConstructor
public class ThreadReportService {

    private final ThreadSnapshotRepository repository;
    private final ThreadCasePackRenderer renderer;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public List<CorrelationThread> threadsForWindow(Instant windowStart, Instant windowEnd) {
        String windowKey = new CorrelationWindow(windowStart, windowEnd, 0, 2).storageKey();
        return repository.findByWindowKeyOrderByThreadIdAsc(windowKey).stream()
                .map(this::toThread)
                .toList();
    }

    @Transactional(readOnly = true)
    public CorrelationThread latestThread(String threadId) {
        return repository.findFirstByThreadIdOrderByIdDesc(threadId)
                .map(this::toThread)
                .orElseThrow(() -> new ThreadNotFoundException(threadId));
    }

    public String casePack(String threadId) {
        return renderer.render(latestThread(threadId), Instant.now());
    }

    private CorrelationThread toThread(ThreadSnapshotRecord snapshot) {
        try {
            return objectMapper.readValue(snapshot.getPayloadJson(), CorrelationThread.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("stored thread payload unreadable: " + snapshot.getThreadId(), e);
        }
    }
}
