package com.flowmable.pixelart;

/**
 * Averaged color of one output grid cell, alpha included.
 *
 * @param r Red channel (0–255)
 * @param g Green channel (0–255)
 * @param b Blue channel (0–255)
 * @param a Alpha channel (0–255), straight (not premultiplied)
 */
public record CellColor(int r, int g, int b, int a) {

    /** Cells at or below this alpha do not take part in palette construction. */
    public static final int VISIBILITY_THRESHOLD = 128;

    public CellColor {
        RgbColor.checkChannel("r", r);
        RgbColor.checkChannel("g", g);
        RgbColor.checkChannel("b", b);
        RgbColor.checkChannel("a", a);
    }

    public boolean isVisible() {
        return a > VISIBILITY_THRESHOLD;
    }

    public RgbColor rgb() {
        return new RgbColor(r, g, b);
    }

    /**
     * Same alpha, color replaced.
     */
    public CellColor withRgb(RgbColor color) {
        return new CellColor(color.r(), color.g(), color.b(), a);
    }

    /** Alpha as a fraction in [0, 1], the form drawing surfaces take. */
    public double alphaFraction() {
        return a / 255.0;
    }
}
