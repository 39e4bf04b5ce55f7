package com.flowmable.pixelart;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;

/**
 * Draws a {@link PixelArt} as N×N blocks with a faint grid outline per cell.
 */
public final class PixelArtRenderer {

    static final double GRID_ALPHA = 0.08;
    static final double GRID_LINE_WIDTH = 0.5;

    private PixelArtRenderer() {}

    /**
     * Paint every cell in row-major order: fill its block with the final color,
     * then stroke an outline inset by a quarter pixel.
     */
    public static void render(PixelArt art, DrawingSurface surface) {
        CellGrid output = art.output();
        int n = art.blockSize();
        for (int y = 0; y < output.height(); y++) {
            for (int x = 0; x < output.width(); x++) {
                CellColor c = output.get(x, y);

                surface.setFill(c.r(), c.g(), c.b(), c.alphaFraction());
                surface.fillRect(x * n, y * n, n, n);

                surface.setStroke(0, 0, 0, GRID_ALPHA, GRID_LINE_WIDTH);
                surface.strokeRect(x * n + 0.25, y * n + 0.25, n - 0.5, n - 0.5);
            }
        }
    }

    /**
     * Render onto a fresh transparent ARGB image of
     * {@code (pixelWidth * N) x (pixelHeight * N)}.
     */
    public static BufferedImage renderToImage(PixelArt art) {
        BufferedImage image = new BufferedImage(art.imageWidth(), art.imageHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g2 = image.createGraphics();
        try {
            render(art, new Graphics2DSurface(g2));
        } finally {
            g2.dispose();
        }
        return image;
    }
}
