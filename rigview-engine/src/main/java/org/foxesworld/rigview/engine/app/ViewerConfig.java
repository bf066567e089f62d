package org.foxesworld.rigview.engine.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.rigview.core.RigViewPlatform;

/**
 * Viewer settings, read once from {@code -Drigview.*} system properties.
 * Bad values fall back to the default with a warning.
 */
public record ViewerConfig(
        int cellSize,
        float cellGap,
        float cellRadius,
        float scale,
        boolean outlines,
        int ioThreads,
        long textureCacheSize,
        int windowWidth,
        int windowHeight,
        String themePath
) {

    private static final Logger log = LogManager.getLogger(ViewerConfig.class);

    public static final int DEFAULT_CELL_SIZE = 120;
    public static final float DEFAULT_GAP = 3f;
    public static final float DEFAULT_RADIUS = 8f;

    public static ViewerConfig defaults() {
        return new ViewerConfig(DEFAULT_CELL_SIZE, DEFAULT_GAP, DEFAULT_RADIUS, 1f, true,
                defaultIoThreads(), 64L, 1280, 720, null);
    }

    public static ViewerConfig fromSystemProperties() {
        ViewerConfig d = defaults();
        int cell = Integer.getInteger("rigview.grid.cellSize", d.cellSize());
        if (cell < RigViewer.MIN_CELL_SIZE || cell > RigViewer.MAX_CELL_SIZE) {
            log.warn("rigview.grid.cellSize={} out of [{}, {}], using {}",
                    cell, RigViewer.MIN_CELL_SIZE, RigViewer.MAX_CELL_SIZE, d.cellSize());
            cell = d.cellSize();
        }
        float scale = floatProp("rigview.scale", d.scale());
        if (scale < RigViewer.MIN_SCALE || scale > RigViewer.MAX_SCALE) {
            log.warn("rigview.scale={} out of [{}, {}], using {}", scale, RigViewer.MIN_SCALE, RigViewer.MAX_SCALE, d.scale());
            scale = d.scale();
        }
        return new ViewerConfig(
                cell,
                Math.max(0f, floatProp("rigview.grid.gap", d.cellGap())),
                Math.max(0f, floatProp("rigview.grid.radius", d.cellRadius())),
                scale,
                Boolean.parseBoolean(System.getProperty("rigview.outlines", "true")),
                Math.max(1, Integer.getInteger("rigview.io.threads", d.ioThreads())),
                Math.max(1L, Long.getLong("rigview.texture.cache", d.textureCacheSize())),
                Math.max(320, Integer.getInteger("rigview.window.width", d.windowWidth())),
                Math.max(240, Integer.getInteger("rigview.window.height", d.windowHeight())),
                System.getProperty("theme.path")
        );
    }

    private static int defaultIoThreads() {
        return Math.max(2, Math.min(4, RigViewPlatform.cpus() / 2));
    }

    private static float floatProp(String key, float def) {
        String raw = System.getProperty(key);
        if (raw == null || raw.isBlank()) return def;
        try {
            float v = Float.parseFloat(raw.trim());
            if (Float.isNaN(v) || Float.isInfinite(v)) throw new NumberFormatException(raw);
            return v;
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}='{}': not a number", key, raw);
            return def;
        }
    }
}
