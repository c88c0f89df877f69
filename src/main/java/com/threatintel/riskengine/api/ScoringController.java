package com.threatintel.riskengine.api;

import com.threatintel.riskengine.domain.model.ScoreResult;
import com.threatintel.riskengine.domain.model.ScoreUncertainty;
import com.threatintel.riskengine.domain.model.SignalRecord;
import com.threatintel.riskengine.domain.service.correlation.CorrelationService;
import com.threatintel.riskengine.domain.service.scoring.ScoreUncertaintyService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/score")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class ScoringController {

    private final CorrelationService correlationService;
    private final ScoreUncertaintyService uncertaintyService;

    @PostMapping
    public ResponseEntity<Map<String, Object>> score(@RequestBody SignalRecord record) {
        ScoreResult result = correlationService.score(record);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("recordId", record.getId());
        body.put("dimension", result.dimension());
        body.put("score", result.score());
        body.put("tier", result.tier());
        body.put("reasonCodes", result.factors());
        body.put("flagged", result.flagged());
        body.put("scorable", result.scorable());
        return ResponseEntity.ok(body);
    }

    @PostMapping("/uncertainty")
    public ResponseEntity<Map<String, Object>> uncertainty(@RequestBody SignalRecord record,
                                                           @RequestParam(required = false) Integer samples,
                                                           @RequestParam(required = false) Long seed) {
        ScoreUncertainty result = uncertaintyService.simulate(record, samples, seed);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("recordId", record.getId());
        body.put("score", result.pointScore());
        body.put("samples", result.samples());
        body.put("mean", result.mean());
        body.put("std", result.std());
        body.put("p05", result.p05());
        body.put("p50", result.p50());
        body.put("p95", result.p95());
        return ResponseEntity.ok(body);
    }
}
