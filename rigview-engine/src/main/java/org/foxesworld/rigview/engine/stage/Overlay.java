package org.foxesworld.rigview.engine.stage;

import com.jme3.scene.Spatial;
import org.foxesworld.rigview.engine.util.Bounds2f;

/**
 * Redrawable 2D drawing (outline, guide, hover). Cleared drawings stay attachable;
 * destroyed ones are gone for good.
 */
public interface Overlay {

    Spatial node();

    /** Removes every shape; the node stays where it is. */
    void clear();

    /** Adds a rectangle in viewport space; {@code radius > 0} rounds the corners. */
    void rect(Bounds2f r, float radius, OverlayStyle style);

    int shapeCount();

    void destroy();

    boolean isDestroyed();
}
