package com.threatintel.riskengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "disagreement_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_disagreement_record_run", columnNames = {"record_id", "run_id"}),
        indexes = @Index(name = "idx_disagreement_run", columnList = "run_id"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisagreementRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    @Column(name = "run_id", nullable = false)
    private String runId;

    @Enumerated(EnumType.STRING)
    private SeverityTier rulesTier;

    @Enumerated(EnumType.STRING)
    private SeverityTier secondaryTier;

    private double rulesScore;

    @Enumerated(EnumType.STRING)
    private AnalystVerdict analystVerdict;

    private long createdAtEpochMs;
    private Long adjudicatedAtEpochMs;
}
