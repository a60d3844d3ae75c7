package com.jay.riskengine.repository;

import com.jay.riskengine.entity.RiskMetricsSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskMetricsSnapshotRepository extends JpaRepository<RiskMetricsSnapshot, Long> {
}
