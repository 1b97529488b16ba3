package com.mirrorgroups.insights.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorgroups.insights.crypto.GroupDataDecryptor;
import com.mirrorgroups.insights.exception.DecryptionException;
import com.mirrorgroups.insights.model.profile.BehavioralProfile;
import com.mirrorgroups.insights.model.profile.CognitiveProfile;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.model.profile.PersonalityProfile;
import com.mirrorgroups.insights.model.profile.ValuesProfile;
import com.mirrorgroups.insights.store.EncryptedMemberRecord;
import com.mirrorgroups.insights.store.ProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads, decrypts and normalizes the profiles members have shared with a group.
 *
 * <p>Only the newest share per member and data type is used. A share that cannot be
 * decrypted or parsed is logged and treated as absent; it never fails the load.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberProfileLoader {

    static final String PERSONALITY = "personality";
    static final String BEHAVIORAL = "behavioral";
    static final String COGNITIVE = "cognitive";
    static final String VALUES = "values";
    static final String FULL_PROFILE = "full_profile";

    private final ProfileStore profileStore;
    private final GroupDataDecryptor decryptor;
    private final LegacyProfileTransformer legacyTransformer;
    private final ObjectMapper objectMapper;

    public List<MemberProfile> load(String groupId) {
        List<EncryptedMemberRecord> records = profileStore.findSharedData(groupId);

        // newest first from the store, so the first record per (user, type) wins
        Map<String, Map<String, EncryptedMemberRecord>> latest = new LinkedHashMap<>();
        for (EncryptedMemberRecord record : records) {
            String dataType = record.getDataType() == null ? "" : record.getDataType().toLowerCase(Locale.ROOT);
            latest.computeIfAbsent(record.getUserId(), k -> new LinkedHashMap<>())
                .putIfAbsent(dataType, record);
        }

        List<MemberProfile> profiles = new ArrayList<>();
        latest.forEach((userId, byType) -> {
            MemberProfile profile = buildProfile(groupId, userId, byType);
            if (profile != null) {
                profiles.add(profile);
            }
        });

        log.debug("Loaded {} member profiles for group {} from {} shares", profiles.size(), groupId, records.size());
        return profiles;
    }

    private MemberProfile buildProfile(String groupId, String userId, Map<String, EncryptedMemberRecord> byType) {
        PersonalityProfile personality = null;
        BehavioralProfile behavioral = null;
        CognitiveProfile cognitive = null;
        ValuesProfile values = null;
        Instant sharedAt = null;
        List<String> sharedTypes = new ArrayList<>();

        // full profile first so that dedicated shares override its sections
        EncryptedMemberRecord full = byType.get(FULL_PROFILE);
        if (full != null) {
            JsonNode node = readShare(full, groupId);
            if (node != null) {
                if (legacyTransformer.isLegacyFullProfile(node)) {
                    node = legacyTransformer.transformFullProfile(node);
                }
                personality = convert(node.get(PERSONALITY), PersonalityProfile.class, userId);
                behavioral = convert(node.get(BEHAVIORAL), BehavioralProfile.class, userId);
                cognitive = convert(node.get(COGNITIVE), CognitiveProfile.class, userId);
                values = convert(node.get(VALUES), ValuesProfile.class, userId);
                sharedTypes.add(FULL_PROFILE);
                sharedAt = later(sharedAt, full.getSharedAt());
            }
        }

        for (Map.Entry<String, EncryptedMemberRecord> entry : byType.entrySet()) {
            String dataType = entry.getKey();
            if (FULL_PROFILE.equals(dataType)) {
                continue;
            }
            JsonNode node = readShare(entry.getValue(), groupId);
            if (node == null) {
                continue;
            }
            switch (dataType) {
                case PERSONALITY:
                    if (legacyTransformer.isLegacyPersonality(node)) {
                        node = legacyTransformer.transformPersonality(node);
                    }
                    personality = orElse(convert(node, PersonalityProfile.class, userId), personality);
                    break;
                case BEHAVIORAL:
                    behavioral = orElse(convert(node, BehavioralProfile.class, userId), behavioral);
                    break;
                case COGNITIVE:
                    if (legacyTransformer.isLegacyCognitive(node)) {
                        node = legacyTransformer.transformCognitive(node);
                    }
                    cognitive = orElse(convert(node, CognitiveProfile.class, userId), cognitive);
                    break;
                case VALUES:
                    values = orElse(convert(node, ValuesProfile.class, userId), values);
                    break;
                default:
                    log.debug("Ignoring share of type {} from member {}", dataType, userId);
                    break;
            }
            sharedTypes.add(dataType);
            sharedAt = later(sharedAt, entry.getValue().getSharedAt());
        }

        if (sharedTypes.isEmpty()) {
            log.warn("No readable shares from member {} in group {}", userId, groupId);
            return null;
        }

        return MemberProfile.builder()
            .userId(userId)
            .sharedAt(sharedAt)
            .sharedDataTypes(List.copyOf(sharedTypes))
            .personality(personality)
            .behavioral(behavioral)
            .cognitive(cognitive)
            .values(values)
            .build();
    }

    private JsonNode readShare(EncryptedMemberRecord record, String groupId) {
        try {
            byte[] plaintext = decryptor.decrypt(record.getCiphertext(), record.getUserId(), groupId);
            return objectMapper.readTree(new String(plaintext, StandardCharsets.UTF_8));
        } catch (DecryptionException e) {
            log.warn("Could not decrypt {} share from member {} in group {}: {}",
                record.getDataType(), record.getUserId(), groupId, e.getMessage());
        } catch (JsonProcessingException e) {
            log.warn("Could not parse {} share from member {} in group {}: {}",
                record.getDataType(), record.getUserId(), groupId, e.getOriginalMessage());
        }
        return null;
    }

    private <T> T convert(JsonNode node, Class<T> type, String userId) {
        if (node == null || !node.isObject()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} for member {}: {}", type.getSimpleName(), userId, e.getOriginalMessage());
            return null;
        }
    }

    private static <T> T orElse(T value, T fallback) {
        return value != null ? value : fallback;
    }

    private static Instant later(Instant current, Instant candidate) {
        if (candidate == null) {
            return current;
        }
        return current == null || candidate.isAfter(current) ? candidate : current;
    }
}
