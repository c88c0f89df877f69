package com.threatintel.riskengine.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Lob;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "thread_snapshot_record", indexes = {
        @Index(name = "idx_thread_snapshot_window", columnList = "window_key"),
        @Index(name = "idx_thread_snapshot_thread", columnList = "thread_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadSnapshotRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "window_key", nullable = false)
    private String windowKey;

    @Column(nullable = false)
    private String runId;

    @Column(name = "thread_id", nullable = false)
    private String threadId;

    private String label;
    private int memberCount;
    private double aggregateScore;
    private double confidence;

    @Enumerated(EnumType.STRING)
    private SeverityTier recommendedTier;

    private long windowStartEpochMs;
    private long windowEndEpochMs;

    @Lob
    @Column(nullable = false)
    private String payloadJson;

    private long writtenAtEpochMs;
}
