package org.foxesworld.rigview.engine.stage;

public interface OverlayFactory {

    /** Draw order: guide below hover below rigs below outlines. */
    int LAYER_GUIDE = 0;
    int LAYER_HOVER = 2;
    int LAYER_RIG = 5;
    int LAYER_OUTLINE = 10;

    Overlay create(String name, int layer);
}
