package com.mirrorgroups.insights.crypto;

import com.mirrorgroups.insights.config.GroupInsightsProperties;
import com.mirrorgroups.insights.exception.DecryptionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Derives a 256-bit AES key per (member, group) as HMAC-SHA256(masterSecret, userId:groupId).
 */
@Component
@Slf4j
public class DerivedGroupKeyResolver implements GroupKeyResolver {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final byte[] masterSecret;

    public DerivedGroupKeyResolver(GroupInsightsProperties properties) {
        String secret = properties.getCrypto().getMasterSecret();
        if (!StringUtils.hasText(secret)) {
            log.warn("insights.crypto.master-secret is not set; shared member data cannot be decrypted");
            this.masterSecret = null;
        } else {
            this.masterSecret = secret.getBytes(StandardCharsets.UTF_8);
        }
    }

    @Override
    public SecretKey resolve(String userId, String groupId) {
        if (masterSecret == null) {
            throw new DecryptionException("No master secret configured for group data keys");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(masterSecret, HMAC_ALGORITHM));
            byte[] keyBytes = mac.doFinal((userId + ":" + groupId).getBytes(StandardCharsets.UTF_8));
            return new SecretKeySpec(keyBytes, "AES");
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to derive data key for user " + userId, e);
        }
    }
}
