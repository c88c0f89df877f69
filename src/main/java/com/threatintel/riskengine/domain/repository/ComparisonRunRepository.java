package com.threatintel.riskengine.domain.repository;

import com.threatintel.riskengine.domain.model.ComparisonRunRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface ComparisonRunRepository extends JpaRepository<ComparisonRunRecord, Long> {

    Optional<ComparisonRunRecord> findByRunId(String runId);

    boolean existsByRunId(String runId);
}
