package com.threatintel.riskengine.api;

import com.threatintel.riskengine.domain.service.evaluation.GoldenIncident;
import com.threatintel.riskengine.domain.service.evaluation.ScoringBacktestEvaluator;
import com.threatintel.riskengine.domain.service.evaluation.VendorFlagEvaluator;
import com.threatintel.riskengine.domain.service.evaluation.VendorProfileCase;
import com.threatintel.riskengine.infra.source.GoldenIncidentLoader;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/evaluation")
@CrossOrigin(origins = "*")
@RequiredArgsConstructor
public class EvaluationController {

    private final VendorFlagEvaluator vendorFlagEvaluator;
    private final ScoringBacktestEvaluator backtestEvaluator;
    private final GoldenIncidentLoader goldenIncidentLoader;

    @PostMapping("/vendor")
    public ResponseEntity<VendorFlagEvaluator.EvaluationReport> vendor(@RequestBody VendorEvaluationRequest req) {
        List<VendorProfileCase> cases = req.cases() != null ? req.cases() : List.of();
        return ResponseEntity.ok(vendorFlagEvaluator.evaluate(cases, req.threshold()));
    }

    @GetMapping("/backtest")
    public ResponseEntity<ScoringBacktestEvaluator.BacktestReport> backtest() {
        return ResponseEntity.ok(backtestEvaluator.run(goldenIncidentLoader.loadDefault()));
    }

    @PostMapping("/backtest")
    public ResponseEntity<ScoringBacktestEvaluator.BacktestReport> backtestIncidents(@RequestBody BacktestRequest req) {
        List<GoldenIncident> incidents = req.incidents() != null ? req.incidents() : List.of();
        return ResponseEntity.ok(backtestEvaluator.run(incidents));
    }

    public record VendorEvaluationRequest(Double threshold, List<VendorProfileCase> cases) {
    }

    public record BacktestRequest(List<GoldenIncident> incidents) {
    }
}
