package com.mirrorgroups.insights.crypto;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.exception.DecryptionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit Tests for AesGcmGroupDataDecryptor
 *
 * @author MirrorGroups Insights Team
 * @version 1.0.0
 * @since 2026-10-01
 */
@DisplayName("AES-GCM Group Data Decryptor Tests")
class AesGcmGroupDataDecryptorTest {

    private static final String GROUP_ID = "group-42";
    private static final String USER_ID = "user-7";

    private DerivedGroupKeyResolver keyResolver;
    private AesGcmGroupDataDecryptor decryptor;

    @BeforeEach
    void setUp() {
        GroupInsightsProperties properties = new GroupInsightsProperties();
        properties.getCrypto().setMasterSecret("test-master-secret");
        keyResolver = new DerivedGroupKeyResolver(properties);
        decryptor = new AesGcmGroupDataDecryptor(keyResolver);
    }

    private String encrypt(String plaintext, String userId, String groupId) throws Exception {
        byte[] iv = new byte[AesGcmGroupDataDecryptor.IV_LENGTH];
        new SecureRandom().nextBytes(iv);

        Cipher cipher = Cipher.getInstance(AesGcmGroupDataDecryptor.TRANSFORMATION);
        cipher.init(Cipher.ENCRYPT_MODE, keyResolver.resolve(userId, groupId),
            new GCMParameterSpec(AesGcmGroupDataDecryptor.GCM_TAG_LENGTH, iv));
        cipher.updateAAD(AesGcmGroupDataDecryptor.associatedData(userId, groupId));
        byte[] encrypted = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

        byte[] combined = new byte[iv.length + encrypted.length];
        System.arraycopy(iv, 0, combined, 0, iv.length);
        System.arraycopy(encrypted, 0, combined, iv.length, encrypted.length);
        return Base64.getEncoder().encodeToString(combined);
    }

    @Test
    @DisplayName("Should decrypt data encrypted for the same member and group")
    void decrypt_Success() throws Exception {
        // Given
        String ciphertext = encrypt("{\"communicationStyle\":\"direct\"}", USER_ID, GROUP_ID);

        // When
        byte[] plaintext = decryptor.decrypt(ciphertext, USER_ID, GROUP_ID);

        // Then
        assertThat(new String(plaintext, StandardCharsets.UTF_8)).isEqualTo("{\"communicationStyle\":\"direct\"}");
    }

    @Test
    @DisplayName("Should reject tampered ciphertext")
    void decrypt_Tampered() throws Exception {
        // Given
        byte[] combined = Base64.getDecoder().decode(encrypt("secret", USER_ID, GROUP_ID));
        combined[combined.length - 1] ^= 0x01;
        String tampered = Base64.getEncoder().encodeToString(combined);

        // When/Then
        assertThatThrownBy(() -> decryptor.decrypt(tampered, USER_ID, GROUP_ID))
            .isInstanceOf(DecryptionException.class);
    }

    @Test
    @DisplayName("Should reject data copied to another group")
    void decrypt_WrongGroup() throws Exception {
        String ciphertext = encrypt("secret", USER_ID, GROUP_ID);

        assertThatThrownBy(() -> decryptor.decrypt(ciphertext, USER_ID, "group-other"))
            .isInstanceOf(DecryptionException.class);
    }

    @Test
    @DisplayName("Should reject malformed input")
    void decrypt_Malformed() {
        assertThatThrownBy(() -> decryptor.decrypt("not base64!", USER_ID, GROUP_ID))
            .isInstanceOf(DecryptionException.class)
            .hasMessageContaining("Base64");
        assertThatThrownBy(() -> decryptor.decrypt(Base64.getEncoder().encodeToString(new byte[4]), USER_ID, GROUP_ID))
            .isInstanceOf(DecryptionException.class)
            .hasMessageContaining("truncated");
    }

    @Test
    @DisplayName("Should refuse to derive keys without a master secret")
    void resolve_NoSecret() {
        DerivedGroupKeyResolver unconfigured = new DerivedGroupKeyResolver(new GroupInsightsProperties());

        assertThatThrownBy(() -> unconfigured.resolve(USER_ID, GROUP_ID))
            .isInstanceOf(DecryptionException.class);
    }
}
