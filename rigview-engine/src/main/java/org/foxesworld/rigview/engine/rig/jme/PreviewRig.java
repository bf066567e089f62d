package org.foxesworld.rigview.engine.rig.jme;

import com.jme3.asset.AssetManager;
import com.jme3.material.Material;
import com.jme3.material.RenderState;
import com.jme3.math.ColorRGBA;
import com.jme3.renderer.queue.RenderQueue;
import com.jme3.scene.Geometry;
import com.jme3.scene.Mesh;
import com.jme3.scene.Spatial;
import com.jme3.scene.VertexBuffer;
import com.jme3.texture.Texture2D;
import com.jme3.util.BufferUtils;
import org.foxesworld.rigview.engine.asset.jme.LoadedAtlas;
import org.foxesworld.rigview.engine.asset.jme.SkeletonData;
import org.foxesworld.rigview.engine.rig.AbstractRigInstance;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.util.List;

/**
 * Setup-pose card of a skeleton: the first atlas page stretched over the skeleton bounds.
 * Playback only advances the track clock; pose evaluation belongs to a skeletal runtime.
 */
public final class PreviewRig extends AbstractRigInstance {

    static final float FALLBACK_SIZE = 100f;

    private final SkeletonData skeleton;
    private final Bounds2f bounds;
    private final Geometry card;

    private float trackTime;

    PreviewRig(String name, SkeletonData skeleton, LoadedAtlas atlas, AssetManager assets) {
        super(name);
        this.skeleton = skeleton;

        Texture2D page = atlas.firstPage();
        this.bounds = resolveBounds(skeleton.bounds(), page);

        card = new Geometry("rig:" + name + ":card", buildCard(bounds));
        card.setMaterial(cardMaterial(assets, page));
        card.setQueueBucket(RenderQueue.Bucket.Gui);
        card.setCullHint(Spatial.CullHint.Never);
        content.attachChild(card);
    }

    @Override
    public List<String> animationNames() {
        return skeleton.animationNames();
    }

    @Override
    public List<String> skinNames() {
        return skeleton.skins();
    }

    @Override
    public Bounds2f localBounds() {
        return bounds;
    }

    public float trackTime() {
        return trackTime;
    }

    @Override
    protected void onAnimationChanged(String name, boolean loop) {
        trackTime = 0f;
    }

    @Override
    protected void onAdvance(float dt) {
        float duration = skeleton.animation(currentAnimation()).map(SkeletonData.Animation::duration).orElse(0f);
        trackTime += dt;
        if (duration <= 0f) return;
        if (isLooping()) {
            trackTime %= duration;
        } else if (trackTime > duration) {
            trackTime = duration;
        }
    }

    @Override
    protected void onDestroy() {
        card.removeFromParent();
    }

    private static Bounds2f resolveBounds(Bounds2f declared, Texture2D page) {
        if (!declared.isEmpty()) return declared;
        float w = FALLBACK_SIZE;
        float h = FALLBACK_SIZE;
        if (page != null && page.getImage() != null) {
            w = page.getImage().getWidth();
            h = page.getImage().getHeight();
        }
        return new Bounds2f(-w / 2f, -h, w, h);
    }

    private static Material cardMaterial(AssetManager assets, Texture2D page) {
        Material m = new Material(assets, "Common/MatDefs/Misc/Unshaded.j3md");
        if (page != null) {
            m.setTexture("ColorMap", page);
        } else {
            m.setColor("Color", ColorRGBA.White);
        }
        RenderState rs = m.getAdditionalRenderState();
        rs.setFaceCullMode(RenderState.FaceCullMode.Off);
        rs.setDepthTest(false);
        rs.setDepthWrite(false);
        rs.setBlendMode(RenderState.BlendMode.Alpha);
        return m;
    }

    /** Quad over {@code r} in y-down space; pages are decoded bottom-up, hence v=1 at the top. */
    private static Mesh buildCard(Bounds2f r) {
        float x0 = r.x(), y0 = r.y(), x1 = r.right(), y1 = r.bottom();
        Mesh mesh = new Mesh();
        mesh.setBuffer(VertexBuffer.Type.Position, 3, BufferUtils.createFloatBuffer(
                x0, y0, 0f,
                x0, y1, 0f,
                x1, y1, 0f,
                x1, y0, 0f));
        mesh.setBuffer(VertexBuffer.Type.TexCoord, 2, BufferUtils.createFloatBuffer(
                0f, 1f,
                0f, 0f,
                1f, 0f,
                1f, 1f));
        mesh.setBuffer(VertexBuffer.Type.Index, 3, BufferUtils.createShortBuffer(
                (short) 0, (short) 1, (short) 2,
                (short) 0, (short) 2, (short) 3));
        mesh.updateBound();
        return mesh;
    }
}
