package com.flowmable.pixelart;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parameters of one pixel-art conversion.
 * <p>
 * The canonical constructor only rejects values the pipeline cannot run with.
 * The user-facing ranges are applied by {@link #of(int, int)} and
 * {@link #parse(String, String)}.
 *
 * @param colorCount  Requested palette size K
 * @param maxSize     Longest side of the target grid, in cells
 * @param blockSize   On-screen size N of one cell, in pixels
 * @param sampleScale Supersampling factor S used by the downsampler
 */
public record ConversionSettings(
        int colorCount,
        int maxSize,
        int blockSize,
        int sampleScale
) {
    private static final Pattern LEADING_INT = Pattern.compile("\\s*([+-]?\\d+)");

    public static final int MIN_COLORS = 24;
    public static final int MAX_COLORS = 256;
    public static final int MIN_SIZE = 20;
    public static final int MAX_SIZE = 200;

    public static final int DEFAULT_COLORS = 24;
    public static final int DEFAULT_SIZE = 80;
    public static final int DEFAULT_BLOCK_SIZE = 12;
    public static final int DEFAULT_SAMPLE_SCALE = 4;

    public static final ConversionSettings DEFAULT = new ConversionSettings(
            DEFAULT_COLORS,
            DEFAULT_SIZE,
            DEFAULT_BLOCK_SIZE,
            DEFAULT_SAMPLE_SCALE
    );

    public ConversionSettings {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1: " + maxSize);
        }
        if (blockSize < 1) {
            throw new IllegalArgumentException("blockSize must be >= 1: " + blockSize);
        }
        if (sampleScale < 1) {
            throw new IllegalArgumentException("sampleScale must be >= 1: " + sampleScale);
        }
    }

    /**
     * Settings with color count clamped to [24, 256] and size to [20, 200].
     */
    public static ConversionSettings of(int colorCount, int maxSize) {
        return new ConversionSettings(
                clamp(colorCount, MIN_COLORS, MAX_COLORS),
                clamp(maxSize, MIN_SIZE, MAX_SIZE),
                DEFAULT_BLOCK_SIZE,
                DEFAULT_SAMPLE_SCALE
        );
    }

    /**
     * Settings from free-form user input. Only the leading integer counts;
     * blank or non-numeric values fall back to the defaults (24 colors,
     * 80 cells) before clamping.
     */
    public static ConversionSettings parse(String colorCount, String maxSize) {
        return of(parseOr(colorCount, DEFAULT_COLORS), parseOr(maxSize, DEFAULT_SIZE));
    }

    /**
     * Reads the leading integer of {@code text}, so "48px" is 48 and "3.5" is 3.
     * Text without a leading integer, and 0, yield {@code fallback}.
     */
    static int parseOr(String text, int fallback) {
        if (text == null) {
            return fallback;
        }
        Matcher m = LEADING_INT.matcher(text);
        if (!m.lookingAt()) {
            return fallback;
        }
        long value;
        try {
            value = Long.parseLong(m.group(1));
        } catch (NumberFormatException e) {
            // More digits than a long holds; only the sign matters after clamping
            value = m.group(1).startsWith("-") ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
        // 0 counts as "no value", same as an empty field
        if (value == 0) {
            return fallback;
        }
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
