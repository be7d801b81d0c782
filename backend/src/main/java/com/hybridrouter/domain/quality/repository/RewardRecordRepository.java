package com.hybridrouter.domain.quality.repository;

import com.hybridrouter.domain.quality.model.RewardRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface RewardRecordRepository extends JpaRepository<RewardRecord, Long> {

    @Query("select r.contentId from RewardRecord r where r.contentId in :contentIds")
    Set<String> findRewardedContentIds(@Param("contentIds") Collection<String> contentIds);

    List<RewardRecord> findByDecidedAtAfterOrderByDecidedAtAsc(Instant since);
}
