package com.threatintel.riskengine.api;

import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.infra.source.InMemoryRecordSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/records")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class RecordIngestController {

    private final InMemoryRecordSource recordSource;

    @PostMapping
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody List<SignalRecord> records) {
        if (records == null || records.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "at least one record is required"
            ));
        }
        int accepted = recordSource.addAll(records);
        log.info("[Records] ingested: submitted={}, accepted={}, stored={}", records.size(), accepted, recordSource.size());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "submitted", records.size(),
                "accepted", accepted,
                "stored", recordSource.size()
        ));
    }

    @GetMapping("/count")
    public ResponseEntity<Map<String, Object>> count() {
        return ResponseEntity.ok(Map.of("success", true, "stored", recordSource.size()));
    }
}
