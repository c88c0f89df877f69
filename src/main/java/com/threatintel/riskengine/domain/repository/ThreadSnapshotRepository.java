package com.threatintel.riskengine.domain.repository;

import com.threatintel.riskengine.domain.model.ThreadSnapshotRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ThreadSnapshotRepository extends JpaRepository<ThreadSnapshotRecord, Long> {

    List<ThreadSnapshotRecord> findByWindowKeyOrderByThreadIdAsc(String windowKey);

    Optional<ThreadSnapshotRecord> findFirstByThreadIdOrderByIdDesc(String threadId);

    @Modifying
    @Query("DELETE FROM ThreadSnapshotRecord t WHERE t.windowKey = :windowKey")
    int deleteByWindowKey(@Param("windowKey") String windowKey);
}
