package org.foxesworld.rigview.engine.grid;

/**
 * Derived grid geometry in viewport space. Never stored; recompute when the viewport or the
 * cell size changes.
 */
public record GridMetrics(float cellSize, float gridWidth, float gridHeight, float left, float top, int rows, int cols) {

    public static GridMetrics of(float viewportWidth, float viewportHeight, float cellSize, int rows, int cols) {
        if (rows <= 0 || cols <= 0) throw new IllegalArgumentException("rows/cols must be > 0");
        float cell = Math.max(0f, cellSize);
        float w = cell * cols;
        float h = cell * rows;
        return new GridMetrics(cell, w, h, viewportWidth / 2f - w / 2f, viewportHeight / 2f - h / 2f, rows, cols);
    }

    public float right() { return left + gridWidth; }
    public float bottom() { return top + gridHeight; }
}
