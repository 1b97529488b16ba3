package com.mirrorgroups.insights.crypto;

import com.mirrorgroups.insights.exception.DecryptionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Base64;

/**
 * AES-256-GCM decryption of shared member data.
 *
 * Stored format: Base64(IV || ciphertext || tag), 96-bit IV, 128-bit tag. The
 * user and group IDs are bound as additional authenticated data, so a payload
 * copied to another member or group fails verification.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AesGcmGroupDataDecryptor implements GroupDataDecryptor {

    static final String TRANSFORMATION = "AES/GCM/NoPadding";
    static final int IV_LENGTH = 12;
    static final int GCM_TAG_LENGTH = 16 * 8;

    private final GroupKeyResolver keyResolver;

    @Override
    public byte[] decrypt(String ciphertext, String userId, String groupId) {
        byte[] combined;
        try {
            combined = Base64.getDecoder().decode(ciphertext);
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Shared data for user " + userId + " is not valid Base64", e);
        }
        if (combined.length <= IV_LENGTH) {
            throw new DecryptionException("Shared data for user " + userId + " is truncated");
        }

        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyResolver.resolve(userId, groupId),
                new GCMParameterSpec(GCM_TAG_LENGTH, combined, 0, IV_LENGTH));
            cipher.updateAAD(associatedData(userId, groupId));
            return cipher.doFinal(combined, IV_LENGTH, combined.length - IV_LENGTH);
        } catch (GeneralSecurityException e) {
            log.warn("Integrity check failed decrypting shared data: userId={}, groupId={}", userId, groupId);
            throw new DecryptionException("Failed to decrypt shared data for user " + userId, e);
        }
    }

    static byte[] associatedData(String userId, String groupId) {
        return (groupId + "/" + userId).getBytes(StandardCharsets.UTF_8);
    }
}
