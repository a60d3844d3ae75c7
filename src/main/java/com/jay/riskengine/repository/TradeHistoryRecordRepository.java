package com.jay.riskengine.repository;

import com.jay.riskengine.entity.TradeHistoryRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TradeHistoryRecordRepository extends JpaRepository<TradeHistoryRecord, Long> {

    List<TradeHistoryRecord> findAllByOrderByIdAsc();
}
