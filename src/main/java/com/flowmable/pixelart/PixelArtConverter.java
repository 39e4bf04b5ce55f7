package com.flowmable.pixelart;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level entry point for the pixel-art pipeline.
 * <p>
 * 1. Downsample: fit the source into a {@code maxSize} grid, supersampled.
 * 2. Quantize: median cut over visible cell colors.
 * 3. Map: replace each cell with its nearest palette color, alpha kept.
 * <p>
 * Immutable and safe to share; every call owns its own buffers.
 */
public class PixelArtConverter {

    private final ConversionSettings settings;

    public PixelArtConverter() {
        this(ConversionSettings.DEFAULT);
    }

    public PixelArtConverter(ConversionSettings settings) {
        this.settings = settings;
    }

    public ConversionSettings settings() {
        return settings;
    }

    public PixelArt convert(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + imageFile);
        }
        try {
            Raster.byteSize(image.getWidth(), image.getHeight());
        } catch (IllegalArgumentException e) {
            throw new IOException(e.getMessage() + ": " + imageFile, e);
        }
        return convert(image);
    }

    public PixelArt convert(BufferedImage image) {
        return convert(Raster.fromImage(image));
    }

    public PixelArt convert(Raster source) {
        int[] size = Downsampler.targetSize(source.width(), source.height(), settings.maxSize());
        CellGrid cells = Downsampler.downsample(source, size[0], size[1], settings.sampleScale());

        Palette palette = MedianCut.quantizeCells(cells, settings.colorCount());
        return new PixelArt(cells, palette, applyPalette(cells, palette), settings.blockSize());
    }

    /**
     * Map every cell onto the palette. An empty palette leaves the grid as is.
     */
    static CellGrid applyPalette(CellGrid cells, Palette palette) {
        if (palette.isEmpty()) {
            return cells;
        }
        List<CellColor> mapped = new ArrayList<>(cells.cells().size());
        for (CellColor c : cells.cells()) {
            mapped.add(palette.map(c));
        }
        return new CellGrid(cells.width(), cells.height(), mapped);
    }
}
