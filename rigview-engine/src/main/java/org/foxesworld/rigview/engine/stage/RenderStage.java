package org.foxesworld.rigview.engine.stage;

import com.jme3.math.Vector2f;
import com.jme3.scene.Spatial;

/**
 * Render tree the synchronizer attaches rigs and overlays to. Viewport space has its origin at
 * the top-left corner and y growing down. Render-thread only.
 */
public interface RenderStage {

    /** False until the render surface exists. */
    boolean isReady();

    float width();

    float height();

    void attach(Spatial child);

    void detach(Spatial child);

    void detachAll();

    boolean isAttached(Spatial child);

    /** Maps a raw pointer position (window/client space) into viewport space. */
    Vector2f toViewport(float clientX, float clientY);
}
