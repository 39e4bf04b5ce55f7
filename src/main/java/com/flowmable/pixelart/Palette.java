package com.flowmable.pixelart;

import java.util.List;

/**
 * Ordered, immutable set of representative colors produced by {@link MedianCut}.
 * <p>
 * {@link #EMPTY} means "no quantization": callers render raw cell colors and
 * must not ask an empty palette for a nearest color.
 */
public record Palette(List<RgbColor> colors) {

    public static final Palette EMPTY = new Palette(List.of());

    public Palette {
        colors = List.copyOf(colors);
    }

    public int size() {
        return colors.size();
    }

    public boolean isEmpty() {
        return colors.isEmpty();
    }

    public RgbColor get(int index) {
        return colors.get(index);
    }

    public RgbColor nearest(RgbColor color) {
        return nearest(color.r(), color.g(), color.b());
    }

    /**
     * Closest entry by squared RGB distance. Strictly-less comparison, so the
     * earliest entry wins a tie.
     *
     * @throws IllegalStateException if the palette is empty
     */
    public RgbColor nearest(int r, int g, int b) {
        if (colors.isEmpty()) {
            throw new IllegalStateException("Cannot map a color onto an empty palette");
        }
        RgbColor closest = colors.get(0);
        int minDist = Integer.MAX_VALUE;
        for (RgbColor c : colors) {
            int dist = c.squaredDistance(r, g, b);
            if (dist < minDist) {
                minDist = dist;
                closest = c;
            }
        }
        return closest;
    }

    /**
     * Nearest palette color with the cell's own alpha kept.
     */
    public CellColor map(CellColor cell) {
        return cell.withRgb(nearest(cell.r(), cell.g(), cell.b()));
    }
}
