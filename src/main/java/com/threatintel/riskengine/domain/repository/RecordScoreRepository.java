package com.threatintel.riskengine.domain.repository;

import com.threatintel.riskengine.domain.model.RecordScoreSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface RecordScoreRepository extends JpaRepository<RecordScoreSnapshot, Long> {

    List<RecordScoreSnapshot> findByWindowKeyOrderByRecordIdAsc(String windowKey);

    @Modifying
    @Query("DELETE FROM RecordScoreSnapshot r WHERE r.windowKey = :windowKey")
    int deleteByWindowKey(@Param("windowKey") String windowKey);
}
