package com.threatintel.riskengine.domain.repository;

import com.threatintel.riskengine.domain.model.DisagreementRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DisagreementRepository extends JpaRepository<DisagreementRecord, Long> {

    boolean existsByRecordIdAndRunId(String recordId, String runId);

    long countByRunId(String runId);

    List<DisagreementRecord> findByRunIdOrderByRecordIdAsc(String runId);

    long countByAnalystVerdictIsNull();
}
