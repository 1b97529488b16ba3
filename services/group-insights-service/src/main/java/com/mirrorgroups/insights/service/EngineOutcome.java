package com.mirrorgroups.insights.service;

import com.mirrorgroups.insights.exception.EngineFailureException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result-or-error of one engine in the analysis fan-out. A skipped engine has neither.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
final class EngineOutcome<T> {

    private final String engine;
    private final T value;
    private final EngineFailureException failure;

    static <T> EngineOutcome<T> succeeded(String engine, T value) {
        return new EngineOutcome<>(engine, value, null);
    }

    static <T> EngineOutcome<T> failed(String engine, EngineFailureException failure) {
        return new EngineOutcome<>(engine, null, failure);
    }

    static <T> EngineOutcome<T> skipped(String engine) {
        return new EngineOutcome<>(engine, null, null);
    }
}
