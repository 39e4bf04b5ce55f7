package com.flowmable.pixelart;

/**
 * An opaque RGB triple. Used both for bucket members during median cut
 * and for palette entries.
 *
 * @param r Red channel (0–255)
 * @param g Green channel (0–255)
 * @param b Blue channel (0–255)
 */
public record RgbColor(int r, int g, int b) {

    public static final int RED = 0;
    public static final int GREEN = 1;
    public static final int BLUE = 2;

    public RgbColor {
        checkChannel("r", r);
        checkChannel("g", g);
        checkChannel("b", b);
    }

    /**
     * Channel value by index: {@link #RED}, {@link #GREEN} or {@link #BLUE}.
     */
    public int channel(int index) {
        return switch (index) {
            case RED -> r;
            case GREEN -> g;
            case BLUE -> b;
            default -> throw new IllegalArgumentException("Unknown channel: " + index);
        };
    }

    /**
     * Squared Euclidean distance in RGB space. No weighting.
     */
    public int squaredDistance(int r2, int g2, int b2) {
        int dr = r - r2;
        int dg = g - g2;
        int db = b - b2;
        return dr * dr + dg * dg + db * db;
    }

    static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException(name + " out of range [0, 255]: " + value);
        }
    }
}
