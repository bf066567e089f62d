package org.foxesworld.rigview.engine.stage.jme;

import com.jme3.asset.AssetManager;
import com.jme3.material.Material;
import com.jme3.material.RenderState;
import com.jme3.math.ColorRGBA;
import com.jme3.renderer.queue.RenderQueue;
import com.jme3.scene.Geometry;
import com.jme3.scene.Mesh;
import com.jme3.scene.Node;
import com.jme3.scene.Spatial;
import org.foxesworld.rigview.engine.stage.Overlay;
import org.foxesworld.rigview.engine.stage.OverlayStyle;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Overlay made of flat gui-bucket geometries. Geometries and per-color materials are reused
 * across redraws; only meshes are rebuilt.
 */
final class JmeOverlay implements Overlay {

    private final AssetManager assets;
    private final Node node;
    private final List<Geometry> pool = new ArrayList<>();
    private final Map<ColorRGBA, Material> materials = new HashMap<>();

    private int used;
    private boolean destroyed;

    JmeOverlay(AssetManager assets, String name, int layer) {
        this.assets = assets;
        this.node = new Node("overlay:" + name);
        node.setLocalTranslation(0f, 0f, layer);
        node.setQueueBucket(RenderQueue.Bucket.Gui);
        node.setCullHint(Spatial.CullHint.Never);
    }

    @Override
    public Spatial node() {
        return node;
    }

    @Override
    public void clear() {
        for (int i = 0; i < used; i++) pool.get(i).removeFromParent();
        used = 0;
    }

    @Override
    public void rect(Bounds2f r, float radius, OverlayStyle style) {
        if (destroyed || r == null || style == null) return;
        float[] pts = OverlayMeshes.outline(r, radius);
        if (style.fill() != null && !r.isEmpty()) {
            add(OverlayMeshes.fill(pts), style.fill());
        }
        if (style.stroke() != null) {
            add(OverlayMeshes.stroke(pts, style.strokeWidth()), style.stroke());
        }
    }

    @Override
    public int shapeCount() {
        return used;
    }

    @Override
    public void destroy() {
        if (destroyed) return;
        destroyed = true;
        clear();
        pool.clear();
        materials.clear();
        node.removeFromParent();
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void add(Mesh mesh, ColorRGBA color) {
        Geometry g;
        if (used < pool.size()) {
            g = pool.get(used);
            g.setMesh(mesh);
        } else {
            g = new Geometry(node.getName() + "#" + used, mesh);
            g.setQueueBucket(RenderQueue.Bucket.Gui);
            g.setCullHint(Spatial.CullHint.Never);
            pool.add(g);
        }
        g.setMaterial(material(color));
        node.attachChild(g);
        used++;
    }

    private Material material(ColorRGBA color) {
        return materials.computeIfAbsent(color, c -> {
            Material m = new Material(assets, "Common/MatDefs/Misc/Unshaded.j3md");
            m.setColor("Color", c.clone());
            RenderState rs = m.getAdditionalRenderState();
            rs.setFaceCullMode(RenderState.FaceCullMode.Off);
            rs.setDepthTest(false);
            rs.setDepthWrite(false);
            rs.setBlendMode(RenderState.BlendMode.Alpha);
            return m;
        });
    }
}
