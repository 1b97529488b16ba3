package com.mirrorgroups.insights.repository;

import com.mirrorgroups.insights.entity.GroupInsightRecord;
import com.mirrorgroups.insights.entity.InsightType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GroupInsightRecordRepository extends JpaRepository<GroupInsightRecord, UUID> {

    Optional<GroupInsightRecord> findByGroupIdAndInsightType(String groupId, InsightType insightType);

    List<GroupInsightRecord> findByGroupId(String groupId);
}
