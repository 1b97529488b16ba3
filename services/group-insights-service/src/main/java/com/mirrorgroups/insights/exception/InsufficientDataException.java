package com.mirrorgroups.insights.exception;

import lombok.Getter;

/**
 * Thrown when a group has fewer members with shared data than an analysis needs.
 * The analysis is not attempted.
 */
@Getter
public class InsufficientDataException extends GroupInsightsException {

    private final String groupId;
    private final int memberCount;

    public InsufficientDataException(String groupId, int memberCount) {
        super(String.format("Insufficient members with shared data for group %s: %d (minimum 2)",
            groupId, memberCount));
        this.groupId = groupId;
        this.memberCount = memberCount;
    }
}
