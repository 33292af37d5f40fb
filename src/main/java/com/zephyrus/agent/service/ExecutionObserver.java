package com.zephyrus.agent.service;

/**
 * Receives human-readable progress lines while a run is in progress.
 */
@FunctionalInterface
public interface ExecutionObserver {

    ExecutionObserver NONE = message -> { };

    void onStep(String message);
}
