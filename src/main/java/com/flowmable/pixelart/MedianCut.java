package com.flowmable.pixelart;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Median-cut color quantization.
 * <p>
 * Deterministic: identical input always produces identical output.
 * Leaves are emitted left child before right child, and the palette keeps
 * that order.
 */
public final class MedianCut {

    private MedianCut() {}

    /**
     * Build a palette from the visible cells of a grid (alpha above
     * {@link CellColor#VISIBILITY_THRESHOLD}).
     */
    public static Palette quantizeCells(CellGrid grid, int k) {
        return quantize(grid.visibleColors(), k);
    }

    /**
     * Quantize colors into at most {@code k} representative colors.
     *
     * @param colors Candidate colors; not modified
     * @param k      Requested palette size
     * @return Palette of 1..k colors, or {@link Palette#EMPTY} when {@code k <= 0}
     *         or {@code colors} is empty
     */
    public static Palette quantize(List<RgbColor> colors, int k) {
        if (k <= 0 || colors.isEmpty()) {
            return Palette.EMPTY;
        }

        List<List<RgbColor>> leaves = new ArrayList<>();
        splitBucket(new ArrayList<>(colors), splitDepth(k), leaves);

        List<RgbColor> result = new ArrayList<>();
        for (List<RgbColor> bucket : leaves.subList(0, Math.min(k, leaves.size()))) {
            if (bucket.isEmpty()) continue;

            long rSum = 0, gSum = 0, bSum = 0;
            for (RgbColor c : bucket) {
                rSum += c.r();
                gSum += c.g();
                bSum += c.b();
            }
            int n = bucket.size();
            result.add(new RgbColor(
                    (int) Math.round((double) rSum / n),
                    (int) Math.round((double) gSum / n),
                    (int) Math.round((double) bSum / n)
            ));
        }
        return new Palette(result);
    }

    /**
     * ceil(log2(k)) for k ≥ 1.
     */
    public static int splitDepth(int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1: " + k);
        }
        return 32 - Integer.numberOfLeadingZeros(k - 1);
    }

    private static void splitBucket(List<RgbColor> bucket, int depth, List<List<RgbColor>> leaves) {
        if (depth == 0 || bucket.isEmpty()) {
            leaves.add(bucket);
            return;
        }

        int minR = 255, maxR = 0, minG = 255, maxG = 0, minB = 255, maxB = 0;
        for (RgbColor c : bucket) {
            if (c.r() < minR) minR = c.r();
            if (c.r() > maxR) maxR = c.r();
            if (c.g() < minG) minG = c.g();
            if (c.g() > maxG) maxG = c.g();
            if (c.b() < minB) minB = c.b();
            if (c.b() > maxB) maxB = c.b();
        }

        int rangeR = maxR - minR;
        int rangeG = maxG - minG;
        int rangeB = maxB - minB;

        // Largest range wins; tie-break: R > G > B. Uniform buckets still split on R.
        final int channel;
        if (rangeR >= rangeG && rangeR >= rangeB) {
            channel = RgbColor.RED;
        } else if (rangeG >= rangeB) {
            channel = RgbColor.GREEN;
        } else {
            channel = RgbColor.BLUE;
        }

        // List.sort is stable, equal keys keep their input order
        bucket.sort(Comparator.comparingInt(c -> c.channel(channel)));

        int mid = bucket.size() / 2;
        splitBucket(new ArrayList<>(bucket.subList(0, mid)), depth - 1, leaves);
        splitBucket(new ArrayList<>(bucket.subList(mid, bucket.size())), depth - 1, leaves);
    }
}
