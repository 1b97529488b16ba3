package com.mirrorgroups.insights.store;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One encrypted share as returned by a {@link ProfileStore}
 */
@Value
@Builder
public class EncryptedMemberRecord {

    String userId;

    String dataType;

    String ciphertext;

    Instant sharedAt;
}
