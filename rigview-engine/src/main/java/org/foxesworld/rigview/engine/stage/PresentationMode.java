package org.foxesworld.rigview.engine.stage;

public enum PresentationMode {
    SINGLE,
    GRID
}
