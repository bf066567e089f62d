package org.foxesworld.rigview.engine.testsupport;

import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.foxesworld.rigview.engine.stage.Overlay;
import org.foxesworld.rigview.engine.stage.OverlayFactory;
import org.foxesworld.rigview.engine.stage.OverlayStyle;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.ArrayList;
import java.util.List;

/** Overlay factory that records every overlay and every rectangle drawn. */
public final class RecordingOverlayFactory implements OverlayFactory {

    public record Shape(Bounds2f rect, float radius, OverlayStyle style) {}

    public static final class FakeOverlay implements Overlay {
        private final Node node;
        private final int layer;
        private final List<Shape> shapes = new ArrayList<>();
        private boolean destroyed;
        private int clears;

        FakeOverlay(String name, int layer) {
            this.node = new Node(name);
            this.layer = layer;
        }

        public String name() { return node.getName(); }
        public int layer() { return layer; }
        public List<Shape> shapes() { return List.copyOf(shapes); }
        public int clears() { return clears; }

        @Override public Spatial node() { return node; }

        @Override
        public void clear() {
            shapes.clear();
            clears++;
        }

        @Override
        public void rect(Bounds2f r, float radius, OverlayStyle style) {
            if (destroyed) throw new IllegalStateException("overlay destroyed: " + name());
            shapes.add(new Shape(r, radius, style));
        }

        @Override public int shapeCount() { return shapes.size(); }

        @Override
        public void destroy() {
            destroyed = true;
            shapes.clear();
            node.removeFromParent();
        }

        @Override public boolean isDestroyed() { return destroyed; }
    }

    private final List<FakeOverlay> created = new ArrayList<>();

    @Override
    public Overlay create(String name, int layer) {
        FakeOverlay o = new FakeOverlay(name, layer);
        created.add(o);
        return o;
    }

    public List<FakeOverlay> created() {
        return List.copyOf(created);
    }

    public List<FakeOverlay> named(String prefix) {
        return created.stream().filter(o -> o.name().startsWith(prefix)).toList();
    }

    public long live(String prefix) {
        return named(prefix).stream().filter(o -> !o.isDestroyed()).count();
    }
}
