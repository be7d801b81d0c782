package com.hybridrouter.domain.routing.repository;

import com.hybridrouter.domain.routing.model.DecisionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;

public interface DecisionRecordRepository extends JpaRepository<DecisionRecord, Long> {

    Optional<DecisionRecord> findTopByContentIdOrderByDecidedAtDesc(String contentId);

    boolean existsByContentId(String contentId);

    @Query("select coalesce(sum(d.estimatedCost), 0) from DecisionRecord d where d.decidedAt >= :from")
    BigDecimal sumEstimatedCostSince(@Param("from") Instant from);
}
