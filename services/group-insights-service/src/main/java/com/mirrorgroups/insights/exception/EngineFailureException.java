package com.mirrorgroups.insights.exception;

import lombok.Getter;

/**
 * Wraps a failure raised inside one scoring engine. The orchestrator logs it
 * and omits that engine's insight block.
 */
@Getter
public class EngineFailureException extends GroupInsightsException {

    private final String engine;

    public EngineFailureException(String engine, Throwable cause) {
        super("Engine " + engine + " failed: " + cause.getMessage(), cause);
        this.engine = engine;
    }
}
