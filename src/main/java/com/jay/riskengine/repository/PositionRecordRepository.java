package com.jay.riskengine.repository;

import com.jay.riskengine.entity.PositionRecord;
import com.jay.riskengine.model.enums.PositionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PositionRecordRepository extends JpaRepository<PositionRecord, Long> {

    List<PositionRecord> findByStatusOrderByPositionIdAsc(PositionStatus status);

    @Query("SELECT MAX(p.positionId) FROM PositionRecord p")
    Long findMaxPositionId();
}
