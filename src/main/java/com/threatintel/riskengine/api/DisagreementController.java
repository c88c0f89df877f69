package com.threatintel.riskengine.api;

import com.threatintel.riskengine.domain.model.AnalystVerdict;
import com.threatintel.riskengine.domain.model.DisagreementRecord;
import com.threatintel.riskengine.domain.service.disagreement.DisagreementMonitor;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/disagreements")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class DisagreementController {

    private final DisagreementMonitor disagreementMonitor;

    @GetMapping("/rate")
    public ResponseEntity<Map<String, Object>> rate(@RequestParam String runId) {
        int compared = disagreementMonitor.findRun(runId).map(r -> r.getComparedCount()).orElse(0);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "runId", runId,
                "comparedCount", compared,
                "rate", disagreementMonitor.disagreementRate(runId)
        ));
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> list(@RequestParam String runId) {
        List<DisagreementRecord> rows = disagreementMonitor.findByRun(runId);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "runId", runId,
                "count", rows.size(),
                "items", rows,
                "pendingAdjudication", disagreementMonitor.pendingAdjudication()
        ));
    }

    @PatchMapping("/{id}/verdict")
    public ResponseEntity<Map<String, Object>> adjudicate(@PathVariable Long id, @RequestBody VerdictRequest req) {
        DisagreementRecord updated = disagreementMonitor.adjudicate(id, req.verdict());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "item", updated
        ));
    }

    public record VerdictRequest(AnalystVerdict verdict) {
    }
}
