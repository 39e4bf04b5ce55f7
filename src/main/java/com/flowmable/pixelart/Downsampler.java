package com.flowmable.pixelart;

import java.util.ArrayList;
import java.util.List;

/**
 * Supersampled box-filter reduction of a raster to a small cell grid.
 * <p>
 * The source is first resampled to {@code (pixelWidth * S) x (pixelHeight * S)}
 * with an area-averaging filter, then every S×S block of that intermediate
 * raster is averaged into one {@link CellColor}. Pure; the source is never touched.
 */
public final class Downsampler {

    private Downsampler() {}

    /**
     * Target grid size for a source of {@code srcW x srcH} whose longer side is
     * fitted to {@code maxSize}. Each side is floored and clamped to at least 1.
     *
     * @return {pixelWidth, pixelHeight}
     */
    public static int[] targetSize(int srcW, int srcH, int maxSize) {
        if (srcW <= 0 || srcH <= 0) {
            throw new IllegalArgumentException("Source must have positive area, got " + srcW + "x" + srcH);
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        double scale = Math.min((double) maxSize / srcW, (double) maxSize / srcH);
        int pw = Math.max(1, (int) Math.floor(srcW * scale));
        int ph = Math.max(1, (int) Math.floor(srcH * scale));
        return new int[]{pw, ph};
    }

    /**
     * Average the source into a {@code pixelWidth x pixelHeight} grid.
     *
     * @param source      Decoded source raster
     * @param pixelWidth  Target grid width, ≥ 1
     * @param pixelHeight Target grid height, ≥ 1
     * @param sampleScale Supersampling factor S, ≥ 1
     * @return Row-major cell grid
     */
    public static CellGrid downsample(Raster source, int pixelWidth, int pixelHeight, int sampleScale) {
        if (pixelWidth < 1 || pixelHeight < 1) {
            throw new IllegalArgumentException("Target grid must be at least 1x1, got "
                    + pixelWidth + "x" + pixelHeight);
        }
        if (sampleScale < 1) {
            throw new IllegalArgumentException("sampleScale must be >= 1: " + sampleScale);
        }

        int sampleW = pixelWidth * sampleScale;
        int sampleH = pixelHeight * sampleScale;
        Raster sample = resample(source, sampleW, sampleH);

        int count = sampleScale * sampleScale;
        List<CellColor> cells = new ArrayList<>(pixelWidth * pixelHeight);
        for (int y = 0; y < pixelHeight; y++) {
            for (int x = 0; x < pixelWidth; x++) {
                long rSum = 0, gSum = 0, bSum = 0, aSum = 0;
                for (int sy = y * sampleScale; sy < (y + 1) * sampleScale; sy++) {
                    for (int sx = x * sampleScale; sx < (x + 1) * sampleScale; sx++) {
                        rSum += sample.red(sx, sy);
                        gSum += sample.green(sx, sy);
                        bSum += sample.blue(sx, sy);
                        aSum += sample.alpha(sx, sy);
                    }
                }
                cells.add(new CellColor(
                        roundMean(rSum, count),
                        roundMean(gSum, count),
                        roundMean(bSum, count),
                        roundMean(aSum, count)
                ));
            }
        }
        return new CellGrid(pixelWidth, pixelHeight, cells);
    }

    /**
     * Area-averaging resample. Every destination pixel is the coverage-weighted
     * mean of the source pixels under its footprint, with color weighted by alpha
     * so transparent neighbours do not bleed black into edges. Separable: a
     * horizontal pass followed by a vertical pass.
     */
    static Raster resample(Raster src, int dstW, int dstH) {
        int w = src.width();
        int h = src.height();
        if (w == dstW && h == dstH) {
            return src;
        }

        // Horizontal pass: h rows of dstW premultiplied pixels {a, r*a, g*a, b*a}
        double[] horizontal = new double[h * dstW * 4];
        double xStep = (double) w / dstW;
        for (int dx = 0; dx < dstW; dx++) {
            double x0 = dx * xStep;
            double x1 = (dx + 1) * xStep;
            int first = (int) Math.floor(x0);
            int last = Math.min(w - 1, (int) Math.ceil(x1) - 1);
            for (int y = 0; y < h; y++) {
                double a = 0, r = 0, g = 0, b = 0;
                for (int sx = first; sx <= last; sx++) {
                    double weight = Math.min(x1, sx + 1) - Math.max(x0, sx);
                    if (weight <= 0) continue;
                    double alpha = src.alpha(sx, y) * weight;
                    a += alpha;
                    r += src.red(sx, y) * alpha;
                    g += src.green(sx, y) * alpha;
                    b += src.blue(sx, y) * alpha;
                }
                int idx = (y * dstW + dx) * 4;
                horizontal[idx] = a / xStep;
                horizontal[idx + 1] = r / xStep;
                horizontal[idx + 2] = g / xStep;
                horizontal[idx + 3] = b / xStep;
            }
        }

        // Vertical pass, then un-premultiply
        byte[] out = new byte[dstW * dstH * Raster.CHANNELS];
        double yStep = (double) h / dstH;
        for (int dy = 0; dy < dstH; dy++) {
            double y0 = dy * yStep;
            double y1 = (dy + 1) * yStep;
            int first = (int) Math.floor(y0);
            int last = Math.min(h - 1, (int) Math.ceil(y1) - 1);
            for (int dx = 0; dx < dstW; dx++) {
                double a = 0, r = 0, g = 0, b = 0;
                for (int sy = first; sy <= last; sy++) {
                    double weight = Math.min(y1, sy + 1) - Math.max(y0, sy);
                    if (weight <= 0) continue;
                    int idx = (sy * dstW + dx) * 4;
                    a += horizontal[idx] * weight;
                    r += horizontal[idx + 1] * weight;
                    g += horizontal[idx + 2] * weight;
                    b += horizontal[idx + 3] * weight;
                }
                int o = (dy * dstW + dx) * Raster.CHANNELS;
                if (a > 0) {
                    out[o] = (byte) clamp(r / a);
                    out[o + 1] = (byte) clamp(g / a);
                    out[o + 2] = (byte) clamp(b / a);
                }
                out[o + 3] = (byte) clamp(a / yStep);
            }
        }
        return new Raster(dstW, dstH, out);
    }

    private static int roundMean(long sum, int count) {
        return clamp((double) sum / count);
    }

    private static int clamp(double v) {
        return Math.min(255, Math.max(0, (int) Math.round(v)));
    }
}
