package org.foxesworld.rigview.engine.slot;

public enum SlotPhase {
    EMPTY,
    LOADING,
    BOUND,
    /** Last attempt failed; no rig, error message kept. */
    FAILED
}
