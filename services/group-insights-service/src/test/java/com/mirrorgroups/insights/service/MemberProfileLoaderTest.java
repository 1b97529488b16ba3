package com.mirrorgroups.insights.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mirrorgroups.insights.crypto.GroupDataDecryptor;
import com.mirrorgroups.insights.exception.DecryptionException;
import com.mirrorgroups.insights.model.profile.MemberProfile;
import com.mirrorgroups.insights.store.EncryptedMemberRecord;
import com.mirrorgroups.insights.store.ProfileStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for MemberProfileLoader
 *
 * The decryptor mock treats ciphertext as plaintext JSON, except for the marker
 * value {@code CORRUPT}, which fails the integrity check.
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("Member Profile Loader Tests")
class MemberProfileLoaderTest {

    private static final String GROUP_ID = "group-1";
    private static final String CORRUPT = "CORRUPT";
    private static final Instant T1 = Instant.parse("2026-09-01T10:00:00Z");
    private static final Instant T2 = Instant.parse("2026-09-10T10:00:00Z");

    @Mock
    private ProfileStore profileStore;

    @Mock
    private GroupDataDecryptor decryptor;

    private MemberProfileLoader loader;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        loader = new MemberProfileLoader(profileStore, decryptor, new LegacyProfileTransformer(objectMapper), objectMapper);

        when(decryptor.decrypt(anyString(), anyString(), eq(GROUP_ID))).thenAnswer(invocation -> {
            String ciphertext = invocation.getArgument(0);
            if (CORRUPT.equals(ciphertext)) {
                throw new DecryptionException("integrity check failed");
            }
            return ciphertext.getBytes(StandardCharsets.UTF_8);
        });
    }

    private static EncryptedMemberRecord share(String userId, String dataType, String json, Instant sharedAt) {
        return EncryptedMemberRecord.builder()
            .userId(userId)
            .dataType(dataType)
            .ciphertext(json)
            .sharedAt(sharedAt)
            .build();
    }

    @Test
    @DisplayName("Should use only the newest share per member and type")
    void load_NewestShareWins() {
        // Given store order is newest first
        when(profileStore.findSharedData(GROUP_ID)).thenReturn(List.of(
            share("u1", "personality", "{\"communicationStyle\":\"direct\"}", T2),
            share("u1", "personality", "{\"communicationStyle\":\"indirect\"}", T1),
            share("u1", "behavioral", "{\"socialEnergy\":55}", T1)));

        // When
        List<MemberProfile> profiles = loader.load(GROUP_ID);

        // Then
        assertThat(profiles).hasSize(1);
        MemberProfile profile = profiles.get(0);
        assertThat(profile.communicationStyle()).contains("direct");
        assertThat(profile.socialEnergy().getAsDouble()).isEqualTo(55.0);
        assertThat(profile.getSharedAt()).isEqualTo(T2);
        assertThat(profile.getSharedDataTypes()).containsExactly("personality", "behavioral");
    }

    @Test
    @DisplayName("Should treat a share that fails decryption as absent")
    void load_DecryptionFailure() {
        // Given
        when(profileStore.findSharedData(GROUP_ID)).thenReturn(List.of(
            share("u1", "personality", CORRUPT, T2),
            share("u1", "values", "{\"coreValues\":[\"honesty\"]}", T1),
            share("u2", "personality", CORRUPT, T1)));

        // When
        List<MemberProfile> profiles = loader.load(GROUP_ID);

        // Then u2 has nothing readable and is skipped
        assertThat(profiles).extracting(MemberProfile::getUserId).containsExactly("u1");
        assertThat(profiles.get(0).getPersonality()).isNull();
        assertThat(profiles.get(0).coreValues()).containsExactly("honesty");
    }

    @Test
    @DisplayName("Should treat unparseable JSON as absent")
    void load_MalformedJson() {
        when(profileStore.findSharedData(GROUP_ID)).thenReturn(List.of(
            share("u1", "behavioral", "{not json", T1)));

        assertThat(loader.load(GROUP_ID)).isEmpty();
    }

    @Test
    @DisplayName("Should convert legacy personality shares")
    void load_LegacyPersonality() {
        // Given
        when(profileStore.findSharedData(GROUP_ID)).thenReturn(List.of(
            share("u1", "PERSONALITY", "{\"bigFive\":{\"openness\":90,\"extraversion\":30},\"mbti\":\"ENFP\"}", T1)));

        // When
        MemberProfile profile = loader.load(GROUP_ID).get(0);

        // Then
        assertThat(profile.embedding()).isPresent();
        assertThat(profile.embedding().get().get(0)).isCloseTo(0.9, within(1e-9));
        assertThat(profile.getPersonality().getInterpersonalStyle()).isEqualTo("ENFP");
        assertThat(profile.communicationStyle()).isEmpty();
    }

    @Test
    @DisplayName("Should let dedicated shares override full profile sections")
    void load_FullProfileOverridden() {
        // Given
        when(profileStore.findSharedData(GROUP_ID)).thenReturn(List.of(
            share("u1", "behavioral", "{\"socialEnergy\":20}", T2),
            share("u1", "full_profile", "{\"behavioral\":{\"socialEnergy\":80},"
                + "\"cognitive\":{\"problemSolvingStyle\":\"systematic\"}}", T1)));

        // When
        MemberProfile profile = loader.load(GROUP_ID).get(0);

        // Then
        assertThat(profile.socialEnergy().getAsDouble()).isEqualTo(20.0);
        assertThat(profile.problemSolvingStyle()).contains("systematic");
        assertThat(profile.getSharedDataTypes()).containsExactly("full_profile", "behavioral");
    }

    @Test
    @DisplayName("Should list unknown share types without using them")
    void load_UnknownType() {
        when(profileStore.findSharedData(GROUP_ID)).thenReturn(List.of(
            share("u1", "astrology", "{\"sign\":\"leo\"}", T1)));

        List<MemberProfile> profiles = loader.load(GROUP_ID);

        assertThat(profiles).hasSize(1);
        assertThat(profiles.get(0).getSharedDataTypes()).containsExactly("astrology");
        assertThat(profiles.get(0).getPersonality()).isNull();
    }
}
