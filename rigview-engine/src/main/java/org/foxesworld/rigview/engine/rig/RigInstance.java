package org.foxesworld.rigview.engine.rig;

import com.jme3.scene.Spatial;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.List;

/**
 * Live renderable rig produced by a {@link RigRuntime}. Owned by exactly one slot.
 * All mutators are render-thread only.
 */
public interface RigInstance {

    /** Scene-graph node to attach to the stage. */
    Spatial node();

    List<String> animationNames();

    List<String> skinNames();

    /** Starts {@code name} on the main track. */
    void setAnimation(String name, boolean loop);

    /** Empty string when nothing plays. */
    String currentAnimation();

    boolean isLooping();

    /** Switches skin and resets slots to the setup pose. */
    void setSkin(String name);

    String currentSkin();

    void setTimeScale(float timeScale);

    float timeScale();

    void setScale(float scale);

    float scale();

    /** Anchor position in viewport space. */
    void setPosition(float x, float y);

    /** Pivot in rig-local space; the anchor point of {@link #setPosition}. */
    void setPivot(float x, float y);

    /** Unscaled bounds in rig-local space. */
    Bounds2f localBounds();

    /** Current bounds in viewport space, after pivot, scale and position. */
    Bounds2f screenBounds();

    /** Advances playback by {@code tpf * timeScale}. */
    void update(float tpf);

    void destroy();

    boolean isDestroyed();
}
