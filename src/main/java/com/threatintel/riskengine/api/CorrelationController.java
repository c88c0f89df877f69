package com.threatintel.riskengine.api;

import com.threatintel.riskengine.domain.model.CorrelationResult;
import com.threatintel.riskengine.domain.model.CorrelationThread;
import com.threatintel.riskengine.domain.model.CorrelationWindow;
import com.threatintel.riskengine.domain.service.correlation.CorrelationRunRegistry;
import com.threatintel.riskengine.domain.service.correlation.CorrelationService;
import com.threatintel.riskengine.domain.service.report.ThreadReportService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/correlation")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class CorrelationController {

    private static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final CorrelationService correlationService;
    private final CorrelationRunRegistry runRegistry;
    private final ThreadReportService threadReportService;

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run(@RequestBody CorrelationRunRequest req) {
        CorrelationResult result = correlationService.correlate(
                req.windowStart(), req.windowEnd(), req.windowHours(), req.minClusterSize());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("runId", result.runId());
        body.put("window", result.window());
        body.put("threadCount", result.threads().size());
        body.put("threads", result.threads());
        body.put("scoredRecords", result.scoredRecords());
        body.put("skippedRecordIds", result.skippedRecordIds());
        body.put("comparedCount", result.comparedCount());
        body.put("disagreementCount", result.disagreementCount());
        return ResponseEntity.ok(body);
    }

    @DeleteMapping("/run")
    public ResponseEntity<Map<String, Object>> cancel(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant windowStart,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant windowEnd) {
        int cancelled = runRegistry.cancelOverlapping(new CorrelationWindow(windowStart, windowEnd, 0, 2));
        return ResponseEntity.ok(Map.of("success", true, "cancelled", cancelled));
    }

    @GetMapping("/runs/active")
    public ResponseEntity<Map<String, Object>> activeRuns() {
        return ResponseEntity.ok(Map.of("success", true, "windows", runRegistry.activeWindows()));
    }

    @GetMapping("/threads")
    public ResponseEntity<Map<String, Object>> threads(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant windowStart,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant windowEnd) {
        List<CorrelationThread> threads = threadReportService.threadsForWindow(windowStart, windowEnd);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "count", threads.size(),
                "threads", threads
        ));
    }

    @GetMapping("/threads/{threadId}")
    public ResponseEntity<Map<String, Object>> thread(@PathVariable String threadId) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "thread", threadReportService.latestThread(threadId)
        ));
    }

    @GetMapping("/threads/{threadId}/casepack")
    public ResponseEntity<String> casePack(@PathVariable String threadId) {
        return ResponseEntity.ok()
                .contentType(TEXT_MARKDOWN)
                .body(threadReportService.casePack(threadId));
    }

    public record CorrelationRunRequest(
            Instant windowStart,
            Instant windowEnd,
            Double windowHours,
            Integer minClusterSize
    ) {
    }
}
