package com.mirrorgroups.insights.store;

import java.util.List;

/**
 * Source of the encrypted data members have shared with a group.
 */
public interface ProfileStore {

    /**
     * @return every share for the group, newest first
     */
    List<EncryptedMemberRecord> findSharedData(String groupId);
}
