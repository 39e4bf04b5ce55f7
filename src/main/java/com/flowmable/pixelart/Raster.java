package com.flowmable.pixelart;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Immutable RGBA8 pixel buffer: row-major, 4 bytes per pixel, no padding.
 * <p>
 * Alpha is straight (not premultiplied). {@link #fromImage(BufferedImage)} is
 * the decode-side adapter; images whose RGBA buffer would exceed
 * {@link #MAX_BYTES} are rejected up front.
 */
public final class Raster {

    public static final int CHANNELS = 4;

    /** Largest buffer a Java array can hold, with the usual VM header slack. */
    public static final long MAX_BYTES = Integer.MAX_VALUE - 8;

    private final int width;
    private final int height;
    private final byte[] rgba;

    public Raster(int width, int height, byte[] rgba) {
        long size = byteSize(width, height);
        if (rgba == null || rgba.length != size) {
            throw new IllegalArgumentException("Expected " + size + " bytes, got "
                    + (rgba == null ? "null" : rgba.length));
        }
        this.width = width;
        this.height = height;
        this.rgba = rgba.clone();
    }

    /**
     * Decode any {@link BufferedImage} into straight RGBA. Images without an alpha
     * channel come out fully opaque.
     */
    public static Raster fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] data = new byte[(int) byteSize(w, h)];
        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            image.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                int idx = (y * w + x) * CHANNELS;
                data[idx] = (byte) (argb >> 16);
                data[idx + 1] = (byte) (argb >> 8);
                data[idx + 2] = (byte) argb;
                data[idx + 3] = (byte) (argb >>> 24);
            }
        }
        return new Raster(w, h, data);
    }

    /**
     * Buffer length for a {@code width x height} raster.
     *
     * @throws IllegalArgumentException if the area is not positive or the
     *         buffer would not fit in a single array
     */
    public static long byteSize(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Raster must have positive area, got " + width + "x" + height);
        }
        long size = (long) width * height * CHANNELS;
        if (size > MAX_BYTES) {
            throw new IllegalArgumentException("Image too large: " + width + "x" + height
                    + " needs " + size + " bytes of RGBA");
        }
        return size;
    }

    static Raster filled(int width, int height, int r, int g, int b, int a) {
        byte[] data = new byte[(int) byteSize(width, height)];
        for (int i = 0; i < data.length; i += CHANNELS) {
            data[i] = (byte) r;
            data[i + 1] = (byte) g;
            data[i + 2] = (byte) b;
            data[i + 3] = (byte) a;
        }
        return new Raster(width, height, data);
    }

    BufferedImage toImage() {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                row[x] = (alpha(x, y) << 24) | (red(x, y) << 16) | (green(x, y) << 8) | blue(x, y);
            }
            image.setRGB(0, y, width, 1, row, 0, width);
        }
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    /**
     * Channel value 0–255 at (x, y); channel 0..3 is R, G, B, A.
     */
    public int channel(int x, int y, int channel) {
        return rgba[(y * width + x) * CHANNELS + channel] & 0xFF;
    }

    public int red(int x, int y) {
        return channel(x, y, 0);
    }

    public int green(int x, int y) {
        return channel(x, y, 1);
    }

    public int blue(int x, int y) {
        return channel(x, y, 2);
    }

    public int alpha(int x, int y) {
        return channel(x, y, 3);
    }

    /** Copy of the backing buffer. */
    byte[] toByteArray() {
        return rgba.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raster other)) return false;
        return width == other.width && height == other.height && Arrays.equals(rgba, other.rgba);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(rgba);
    }

    @Override
    public String toString() {
        return "Raster[" + width + "x" + height + "]";
    }
}
