package com.mirrorgroups.insights.repository;

import com.mirrorgroups.insights.entity.SharedMemberData;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SharedMemberDataRepository extends JpaRepository<SharedMemberData, UUID> {

    List<SharedMemberData> findByGroupIdOrderBySharedAtDesc(String groupId);
}
