package com.mirrorgroups.insights.crypto;

import com.mirrorgroups.insights.exception.DecryptionException;

/**
 * Per-member decryption of data shared with a group.
 */
public interface GroupDataDecryptor {

    /**
     * @param ciphertext encoded ciphertext as stored
     * @param userId member who shared the data
     * @param groupId group it was shared with
     * @return plaintext bytes
     * @throws DecryptionException on any key, format or integrity failure; never returns
     *         unverified plaintext
     */
    byte[] decrypt(String ciphertext, String userId, String groupId);
}
