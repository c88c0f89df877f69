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
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "record_score_snapshot", indexes = {
        @Index(name = "idx_record_score_window", columnList = "window_key"),
        @Index(name = "idx_record_score_record", columnList = "record_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordScoreSnapshot {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "window_key", nullable = false)
    private String windowKey;

    @Column(nullable = false)
    private String runId;

    @Column(name = "record_id", nullable = false)
    private String recordId;

    @Enumerated(EnumType.STRING)
    private SourceType sourceType;

    private double riskScore;

    @Enumerated(EnumType.STRING)
    private SeverityTier severityTier;

    private String scoreFactors;
    private Boolean vendorFlagged;
    private boolean clustered;
    private long scoredAtEpochMs;
}
