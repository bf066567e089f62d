package org.foxesworld.rigview.engine.stage;

import com.jme3.math.ColorRGBA;

/** Fill and/or stroke for one overlay shape. Null parts are not drawn. */
public record OverlayStyle(ColorRGBA fill, ColorRGBA stroke, float strokeWidth) {

    public static OverlayStyle fill(int rgb, float alpha) {
        return new OverlayStyle(color(rgb, alpha), null, 0f);
    }

    public static OverlayStyle stroke(int rgb, float alpha, float width) {
        return new OverlayStyle(null, color(rgb, alpha), width);
    }

    public static OverlayStyle fillAndStroke(int fillRgb, float fillAlpha, int strokeRgb, float strokeAlpha, float width) {
        return new OverlayStyle(color(fillRgb, fillAlpha), color(strokeRgb, strokeAlpha), width);
    }

    public static ColorRGBA color(int rgb, float alpha) {
        return new ColorRGBA(
                ((rgb >> 16) & 0xff) / 255f,
                ((rgb >> 8) & 0xff) / 255f,
                (rgb & 0xff) / 255f,
                alpha
        );
    }
}
