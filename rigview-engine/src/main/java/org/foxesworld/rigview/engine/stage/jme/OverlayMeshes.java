package org.foxesworld.rigview.engine.stage.jme;

import com.jme3.scene.Mesh;
import com.jme3.scene.VertexBuffer;
import com.jme3.util.BufferUtils;
import org.foxesworld.rigview.engine.util.Bounds2f;

import java.nio.FloatBuffer;
import java.nio.IntBuffer;

/** Flat 2D meshes for overlays: filled polygons and thick outlines as quad strips. */
final class OverlayMeshes {

    static final int CORNER_SEGMENTS = 6;

    private OverlayMeshes() {}

    /** Closed outline of {@code r} as x,y pairs, clockwise in y-down space. */
    static float[] outline(Bounds2f r, float radius) {
        float rad = Math.min(Math.max(radius, 0f), Math.min(r.width(), r.height()) / 2f);
        if (rad <= 0f) {
            return new float[]{
                    r.x(), r.y(),
                    r.right(), r.y(),
                    r.right(), r.bottom(),
                    r.x(), r.bottom()
            };
        }

        float[] out = new float[4 * (CORNER_SEGMENTS + 1) * 2];
        int i = 0;
        // corner centers: top-right, bottom-right, bottom-left, top-left
        float[][] centers = {
                {r.right() - rad, r.y() + rad},
                {r.right() - rad, r.bottom() - rad},
                {r.x() + rad, r.bottom() - rad},
                {r.x() + rad, r.y() + rad}
        };
        for (int c = 0; c < 4; c++) {
            float start = (float) (-Math.PI / 2 + c * Math.PI / 2);
            for (int s = 0; s <= CORNER_SEGMENTS; s++) {
                float a = start + (float) (Math.PI / 2) * s / CORNER_SEGMENTS;
                out[i++] = centers[c][0] + (float) Math.cos(a) * rad;
                out[i++] = centers[c][1] + (float) Math.sin(a) * rad;
            }
        }
        return out;
    }

    /** Triangle fan around the centroid of a convex polygon. */
    static Mesh fill(float[] pts) {
        int n = pts.length / 2;
        float cx = 0f, cy = 0f;
        for (int i = 0; i < n; i++) {
            cx += pts[i * 2];
            cy += pts[i * 2 + 1];
        }
        cx /= n;
        cy /= n;

        FloatBuffer pos = BufferUtils.createFloatBuffer((n + 1) * 3);
        IntBuffer idx = BufferUtils.createIntBuffer(n * 3);
        pos.put(cx).put(cy).put(0f);
        for (int i = 0; i < n; i++) {
            pos.put(pts[i * 2]).put(pts[i * 2 + 1]).put(0f);
            idx.put(0).put(1 + i).put(1 + (i + 1) % n);
        }
        return build(pos, idx);
    }

    /** One quad per edge, {@code width} thick, centered on the edge. */
    static Mesh stroke(float[] pts, float width) {
        int n = pts.length / 2;
        float half = Math.max(width, 0.5f) * 0.5f;

        FloatBuffer pos = BufferUtils.createFloatBuffer(n * 4 * 3);
        IntBuffer idx = BufferUtils.createIntBuffer(n * 6);
        int v = 0;
        for (int i = 0; i < n; i++) {
            float ax = pts[i * 2], ay = pts[i * 2 + 1];
            float bx = pts[((i + 1) % n) * 2], by = pts[((i + 1) % n) * 2 + 1];
            float dx = bx - ax, dy = by - ay;
            float len = (float) Math.sqrt(dx * dx + dy * dy);
            if (len == 0f) len = 1f;
            float nx = -dy / len * half, ny = dx / len * half;

            pos.put(ax - nx).put(ay - ny).put(0f);
            pos.put(bx - nx).put(by - ny).put(0f);
            pos.put(bx + nx).put(by + ny).put(0f);
            pos.put(ax + nx).put(ay + ny).put(0f);

            idx.put(v).put(v + 1).put(v + 2);
            idx.put(v).put(v + 2).put(v + 3);
            v += 4;
        }
        return build(pos, idx);
    }

    private static Mesh build(FloatBuffer pos, IntBuffer idx) {
        Mesh mesh = new Mesh();
        mesh.setMode(Mesh.Mode.Triangles);
        mesh.setBuffer(VertexBuffer.Type.Position, 3, pos);
        mesh.setBuffer(VertexBuffer.Type.Index, 3, idx);
        mesh.updateBound();
        return mesh;
    }
}
