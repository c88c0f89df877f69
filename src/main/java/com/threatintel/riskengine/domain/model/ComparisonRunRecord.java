package com.threatintel.riskengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Denominator of the disagreement rate: how many records of a run carried both tiers.
 */
@Entity
@Table(name = "comparison_run_record")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComparisonRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true)
    private String runId;

    private int comparedCount;
    private int mismatchCount;
    private long createdAtEpochMs;
}
