package org.foxesworld.rigview.engine.testsupport;

import com.jme3.math.Vector2f;
import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.foxesworld.rigview.engine.stage.RenderStage;

import java.util.List;

/** Scene-graph stage without a renderer. Client coordinates are viewport coordinates. */
public final class TestStage implements RenderStage {

    private final Node root = new Node("test:stage");
    private boolean ready;
    private float width;
    private float height;

    public TestStage(float width, float height) {
        resize(width, height);
    }

    public static TestStage notReady() {
        TestStage s = new TestStage(0f, 0f);
        s.ready = false;
        return s;
    }

    public void resize(float w, float h) {
        this.width = w;
        this.height = h;
        this.ready = w > 0f && h > 0f;
    }

    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public List<Spatial> children() {
        return List.copyOf(root.getChildren());
    }

    @Override public boolean isReady() { return ready; }
    @Override public float width() { return width; }
    @Override public float height() { return height; }

    @Override
    public void attach(Spatial child) {
        root.attachChild(child);
    }

    @Override
    public void detach(Spatial child) {
        root.detachChild(child);
    }

    @Override
    public void detachAll() {
        root.detachAllChildren();
    }

    @Override
    public boolean isAttached(Spatial child) {
        return child != null && child.getParent() == root;
    }

    @Override
    public Vector2f toViewport(float clientX, float clientY) {
        return new Vector2f(clientX, clientY);
    }
}
