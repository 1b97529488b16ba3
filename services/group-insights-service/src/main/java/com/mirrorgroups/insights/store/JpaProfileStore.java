package com.mirrorgroups.insights.store;

import com.mirrorgroups.insights.entity.SharedMemberData;
import com.mirrorgroups.insights.repository.SharedMemberDataRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class JpaProfileStore implements ProfileStore {

    private final SharedMemberDataRepository repository;

    @Override
    @Transactional(readOnly = true)
    public List<EncryptedMemberRecord> findSharedData(String groupId) {
        return repository.findByGroupIdOrderBySharedAtDesc(groupId).stream()
            .map(JpaProfileStore::toRecord)
            .collect(Collectors.toList());
    }

    private static EncryptedMemberRecord toRecord(SharedMemberData row) {
        return EncryptedMemberRecord.builder()
            .userId(row.getUserId())
            .dataType(row.getDataType())
            .ciphertext(row.getEncryptedPayload())
            .sharedAt(row.getSharedAt().toInstant(ZoneOffset.UTC))
            .build();
    }
}
