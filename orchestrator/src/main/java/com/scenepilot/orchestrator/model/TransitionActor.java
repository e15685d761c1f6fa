package com.scenepilot.orchestrator.model;

/** Who caused a stage transition. */
public enum TransitionActor {
    SYSTEM,     // gating rule or regular advance()
    OVERRIDE    // forceAdvance() or reset()
}
