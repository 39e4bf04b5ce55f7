package com.flowmable.pixelart;

/**
 * Result of one conversion.
 *
 * @param cells     Averaged cell colors straight out of the downsampler
 * @param palette   Quantized palette; {@link Palette#EMPTY} when quantization was skipped
 * @param output    Final cell colors: mapped onto the palette, or {@code cells} unchanged
 * @param blockSize On-screen size of one cell, in pixels
 */
public record PixelArt(CellGrid cells, Palette palette, CellGrid output, int blockSize) {

    public PixelArt {
        if (cells.width() != output.width() || cells.height() != output.height()) {
            throw new IllegalArgumentException("Output grid does not match source grid");
        }
    }

    public int pixelWidth() {
        return cells.width();
    }

    public int pixelHeight() {
        return cells.height();
    }

    public boolean isQuantized() {
        return !palette.isEmpty();
    }

    /** Width of the rendered image in pixels. */
    public int imageWidth() {
        return pixelWidth() * blockSize;
    }

    /** Height of the rendered image in pixels. */
    public int imageHeight() {
        return pixelHeight() * blockSize;
    }
}
