package org.foxesworld.rigview.engine.rig;

import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.Objects;

/**
 * Transform and playback bookkeeping shared by rig implementations.
 *
 * <p>Layout: {@code root} carries position and uniform scale, {@code content} is offset by
 * the negated pivot so the pivot lands on the position.</p>
 */
public abstract class AbstractRigInstance implements RigInstance {

    protected final Node root;
    protected final Node content;

    private String animation = "";
    private boolean looping = true;
    private String skin = "";
    private float timeScale = 1f;
    private float scale = 1f;
    private float posX, posY;
    private float pivotX, pivotY;
    private boolean destroyed;

    protected AbstractRigInstance(String name) {
        Objects.requireNonNull(name, "name");
        this.root = new Node("rig:" + name);
        this.content = new Node("rig:" + name + ":content");
        root.attachChild(content);
    }

    @Override
    public Spatial node() {
        return root;
    }

    @Override
    public void setAnimation(String name, boolean loop) {
        if (name == null || name.isBlank()) return;
        if (!animationNames().contains(name)) {
            throw new IllegalArgumentException("Unknown animation: " + name);
        }
        this.animation = name;
        this.looping = loop;
        onAnimationChanged(name, loop);
    }

    @Override public String currentAnimation() { return animation; }
    @Override public boolean isLooping() { return looping; }

    @Override
    public void setSkin(String name) {
        if (name == null || name.isBlank()) return;
        if (!skinNames().contains(name)) {
            throw new IllegalArgumentException("Unknown skin: " + name);
        }
        this.skin = name;
        onSkinChanged(name);
    }

    @Override public String currentSkin() { return skin; }

    @Override
    public void setTimeScale(float timeScale) {
        this.timeScale = Math.max(0f, timeScale);
    }

    @Override public float timeScale() { return timeScale; }

    @Override
    public void setScale(float scale) {
        this.scale = scale;
        root.setLocalScale(scale);
    }

    @Override public float scale() { return scale; }

    @Override
    public void setPosition(float x, float y) {
        this.posX = x;
        this.posY = y;
        root.setLocalTranslation(x, y, root.getLocalTranslation().z);
    }

    @Override
    public void setPivot(float x, float y) {
        this.pivotX = x;
        this.pivotY = y;
        content.setLocalTranslation(-x, -y, 0f);
    }

    @Override
    public Bounds2f screenBounds() {
        Bounds2f local = localBounds();
        return new Bounds2f(
                posX + (local.x() - pivotX) * scale,
                posY + (local.y() - pivotY) * scale,
                local.width() * scale,
                local.height() * scale
        );
    }

    @Override
    public void update(float tpf) {
        if (destroyed || timeScale <= 0f || animation.isEmpty()) return;
        onAdvance(tpf * timeScale);
    }

    @Override
    public final void destroy() {
        if (destroyed) return;
        destroyed = true;
        root.removeFromParent();
        try {
            onDestroy();
        } finally {
            content.detachAllChildren();
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    protected void onAnimationChanged(String name, boolean loop) {}

    protected void onSkinChanged(String name) {}

    protected void onAdvance(float dt) {}

    protected void onDestroy() {}
}
