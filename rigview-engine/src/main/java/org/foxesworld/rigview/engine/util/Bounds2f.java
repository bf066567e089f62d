package org.foxesworld.rigview.engine.util;

/** Axis-aligned rectangle in viewport space (origin top-left, y grows down). */
public record Bounds2f(float x, float y, float width, float height) {

    public static final Bounds2f EMPTY = new Bounds2f(0f, 0f, 0f, 0f);

    public float right() { return x + width; }
    public float bottom() { return y + height; }
    public float centerX() { return x + width / 2f; }
    public float centerY() { return y + height / 2f; }

    public boolean isEmpty() {
        return width <= 0f || height <= 0f;
    }

    /** Half-open containment: {@code [x, x+width) x [y, y+height)}. */
    public boolean contains(float px, float py) {
        return px >= x && px < x + width && py >= y && py < y + height;
    }

    public Bounds2f offset(float dx, float dy) {
        return new Bounds2f(x + dx, y + dy, width, height);
    }

    public Bounds2f inset(float d) {
        float w = Math.max(width - 2f * d, 0f);
        float h = Math.max(height - 2f * d, 0f);
        return new Bounds2f(x + (width - w) / 2f, y + (height - h) / 2f, w, h);
    }
}
