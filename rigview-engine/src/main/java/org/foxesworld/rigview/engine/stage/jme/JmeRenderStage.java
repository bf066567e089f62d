package org.foxesworld.rigview.engine.stage.jme;

import com.jme3.math.Vector2f;
import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.engine.stage.RenderStage;

import java.util.Objects;

/**
 * {@link RenderStage} under the jME gui node. The stage root is flipped so children are laid
 * out in viewport space (origin top-left, y down) while the gui node stays y-up.
 */
public final class JmeRenderStage implements RenderStage {

    private static final Logger log = LogManager.getLogger(JmeRenderStage.class);

    private final Node root = new Node("rigview:stage");

    private float width;
    private float height;
    private boolean ready;

    public JmeRenderStage(Node guiNode) {
        Objects.requireNonNull(guiNode, "guiNode").attachChild(root);
    }

    /** Called with the framebuffer size on start and whenever it changes. */
    public void resize(int w, int h) {
        this.width = Math.max(w, 1);
        this.height = Math.max(h, 1);
        root.setLocalTranslation(0f, height, 0f);
        root.setLocalScale(1f, -1f, 1f);
        if (!ready) log.info("Render stage ready {}x{}", (int) width, (int) height);
        ready = true;
    }

    public Node root() {
        return root;
    }

    @Override public boolean isReady() { return ready; }
    @Override public float width() { return width; }
    @Override public float height() { return height; }

    @Override
    public void attach(Spatial child) {
        root.attachChild(Objects.requireNonNull(child, "child"));
    }

    @Override
    public void detach(Spatial child) {
        if (child != null) root.detachChild(child);
    }

    @Override
    public void detachAll() {
        root.detachAllChildren();
    }

    @Override
    public boolean isAttached(Spatial child) {
        return child != null && child.getParent() == root;
    }

    /** jME cursor positions have their origin at the bottom-left corner. */
    @Override
    public Vector2f toViewport(float clientX, float clientY) {
        return new Vector2f(clientX, height - clientY);
    }

    public void dispose() {
        root.detachAllChildren();
        root.removeFromParent();
        ready = false;
    }
}
