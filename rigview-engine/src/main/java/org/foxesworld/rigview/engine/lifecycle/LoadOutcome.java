package org.foxesworld.rigview.engine.lifecycle;

/** How a load request ended for its slot. */
public enum LoadOutcome {
    /** The rig is installed in the slot. */
    APPLIED,
    /** A newer request (or clear/shutdown) replaced this one; its result was discarded. */
    SUPERSEDED,
    /** The slot now carries the failure message. */
    FAILED
}
