package com.flowmable.pixelart;

import java.util.ArrayList;
import java.util.List;

/**
 * Row-major grid of cell colors, {@code width * height} entries.
 */
public record CellGrid(int width, int height, List<CellColor> cells) {

    public CellGrid {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Grid must be at least 1x1, got " + width + "x" + height);
        }
        cells = List.copyOf(cells);
        if (cells.size() != width * height) {
            throw new IllegalArgumentException(
                    "Expected " + (width * height) + " cells, got " + cells.size());
        }
    }

    public CellColor get(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Cell (" + x + ", " + y + ") outside " + width + "x" + height);
        }
        return cells.get(y * width + x);
    }

    /**
     * RGB of every cell whose alpha exceeds {@link CellColor#VISIBILITY_THRESHOLD}, in row-major order.
     */
    public List<RgbColor> visibleColors() {
        List<RgbColor> result = new ArrayList<>();
        for (CellColor c : cells) {
            if (c.isVisible()) {
                result.add(c.rgb());
            }
        }
        return result;
    }
}
