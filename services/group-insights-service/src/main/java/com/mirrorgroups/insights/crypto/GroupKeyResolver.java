package com.mirrorgroups.insights.crypto;

import javax.crypto.SecretKey;

/**
 * Supplies the data key a member used when sharing with a group.
 */
public interface GroupKeyResolver {

    SecretKey resolve(String userId, String groupId);
}
