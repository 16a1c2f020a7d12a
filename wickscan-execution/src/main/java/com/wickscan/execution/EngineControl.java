package com.wickscan.execution;

/**
 * Operator commands exposed by the engine.
 */
public interface EngineControl {

    void enable();

    void disable();

    EngineStatus status();

    boolean forceClose(String positionId);

    int forceCloseAll();
}
