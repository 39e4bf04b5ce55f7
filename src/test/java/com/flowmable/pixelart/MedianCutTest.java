package com.flowmable.pixelart;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MedianCutTest {

    private static RgbColor rgb(int r, int g, int b) {
        return new RgbColor(r, g, b);
    }

    /** 16 levels per channel, 4096 distinct colors */
    private static List<RgbColor> colorCube() {
        List<RgbColor> colors = new ArrayList<>();
        for (int i = 0; i < 4096; i++) {
            colors.add(rgb((i % 16) * 16, ((i / 16) % 16) * 16, (i / 256) * 16));
        }
        return colors;
    }

    @Test
    void splitDepth_isCeilLog2() {
        assertEquals(0, MedianCut.splitDepth(1));
        assertEquals(1, MedianCut.splitDepth(2));
        assertEquals(2, MedianCut.splitDepth(3));
        assertEquals(2, MedianCut.splitDepth(4));
        assertEquals(5, MedianCut.splitDepth(24));
        assertEquals(5, MedianCut.splitDepth(32));
        assertEquals(6, MedianCut.splitDepth(33));
        assertEquals(8, MedianCut.splitDepth(256));
        assertThrows(IllegalArgumentException.class, () -> MedianCut.splitDepth(0));
    }

    @Test
    void nonPositiveK_emptyPalette() {
        List<RgbColor> colors = List.of(rgb(1, 2, 3), rgb(200, 100, 50));
        assertSame(Palette.EMPTY, MedianCut.quantize(colors, 0));
        assertSame(Palette.EMPTY, MedianCut.quantize(colors, -7));
    }

    @Test
    void emptyInput_emptyPalette() {
        assertTrue(MedianCut.quantize(List.of(), 24).isEmpty());
    }

    @Test
    void singleColor_oneEntry() {
        List<RgbColor> colors = Collections.nCopies(100, rgb(255, 0, 0));
        Palette palette = MedianCut.quantize(colors, 24);

        assertEquals(List.of(rgb(255, 0, 0)), palette.colors());
    }

    @Test
    void kOne_meanOfAllColors() {
        Palette palette = MedianCut.quantize(List.of(rgb(0, 0, 0), rgb(1, 10, 255)), 1);
        // 0.5 rounds up
        assertEquals(List.of(rgb(1, 5, 128)), palette.colors());
    }

    @Test
    void uniformBucket_stillSplitsWithoutFault() {
        List<RgbColor> colors = Collections.nCopies(4, rgb(50, 60, 70));
        Palette palette = MedianCut.quantize(colors, 4);

        assertEquals(4, palette.size());
        for (RgbColor c : palette.colors()) {
            assertEquals(rgb(50, 60, 70), c);
        }
    }

    @Test
    void leavesTruncatedToK_inTraversalOrder() {
        List<RgbColor> colors = List.of(rgb(30, 0, 0), rgb(0, 0, 0), rgb(20, 0, 0), rgb(10, 0, 0));
        Palette palette = MedianCut.quantize(colors, 3);

        assertEquals(List.of(rgb(0, 0, 0), rgb(10, 0, 0), rgb(20, 0, 0)), palette.colors());
    }

    @Test
    void emptyLeavesCountTowardTruncation() {
        // A one-color bucket splits into an empty leaf and itself, so with
        // two colors and k=3 (depth 2) the leaves are [], [a], [], [b]
        // and truncation to 3 drops b.
        List<RgbColor> colors = List.of(rgb(0, 0, 0), rgb(255, 255, 255));
        Palette palette = MedianCut.quantize(colors, 3);

        assertEquals(List.of(rgb(0, 0, 0)), palette.colors());
    }

    @Test
    void channelTieBreak_redBeforeGreen() {
        // rangeR == rangeG == 100: sorting on R puts (0,100,0) first
        Palette palette = MedianCut.quantize(List.of(rgb(100, 0, 0), rgb(0, 100, 0)), 2);
        assertEquals(List.of(rgb(0, 100, 0), rgb(100, 0, 0)), palette.colors());
    }

    @Test
    void channelTieBreak_greenBeforeBlue() {
        // rangeG == rangeB == 100: sorting on G puts (0,0,100) first
        Palette palette = MedianCut.quantize(List.of(rgb(0, 100, 0), rgb(0, 0, 100)), 2);
        assertEquals(List.of(rgb(0, 0, 100), rgb(0, 100, 0)), palette.colors());
    }

    @Test
    void largestRangeChannel_wins() {
        // B has the widest range; sorting on B gives (90,0,0) then (0,0,200)
        Palette palette = MedianCut.quantize(List.of(rgb(0, 0, 200), rgb(90, 0, 0)), 2);
        assertEquals(List.of(rgb(90, 0, 0), rgb(0, 0, 200)), palette.colors());
    }

    @Test
    void oddBucket_midpointFloors() {
        // 3 colors, k=2: mid = 1, so [0] and [100, 200]
        Palette palette = MedianCut.quantize(List.of(rgb(200, 0, 0), rgb(0, 0, 0), rgb(100, 0, 0)), 2);
        assertEquals(List.of(rgb(0, 0, 0), rgb(150, 0, 0)), palette.colors());
    }

    @Test
    void inputList_notModified() {
        List<RgbColor> colors = new ArrayList<>(List.of(rgb(200, 5, 5), rgb(3, 90, 40), rgb(120, 7, 250)));
        List<RgbColor> before = List.copyOf(colors);
        MedianCut.quantize(colors, 2);
        assertEquals(before, colors);
    }

    @Test
    void randomInputs_paletteSizeWithinOneToK() {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            int n = 1 + random.nextInt(400);
            List<RgbColor> colors = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                colors.add(rgb(random.nextInt(256), random.nextInt(256), random.nextInt(256)));
            }
            int k = 1 + random.nextInt(300);
            Palette palette = MedianCut.quantize(colors, k);
            assertTrue(palette.size() >= 1 && palette.size() <= k,
                    "n=" + n + " k=" + k + " size=" + palette.size());
        }
    }

    @Test
    void sameInput_identicalPalette() {
        Random random = new Random(7);
        List<RgbColor> colors = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            // Narrow value set so sorts see many equal keys
            colors.add(rgb(random.nextInt(4) * 80, random.nextInt(4) * 80, random.nextInt(4) * 80));
        }
        assertEquals(MedianCut.quantize(colors, 24), MedianCut.quantize(colors, 24));
        assertEquals(MedianCut.quantize(colors, 200), MedianCut.quantize(colors, 200));
    }

    @Test
    void paletteLength_nonDecreasingInK() {
        List<RgbColor> colors = colorCube();
        int previous = 0;
        for (int k = 24; k <= 256; k++) {
            int size = MedianCut.quantize(colors, k).size();
            assertEquals(k, size, "Every leaf is populated, so size should equal k");
            assertTrue(size >= previous);
            previous = size;
        }
    }

    @Test
    void quantizeCells_ignoresCellsAtOrBelowThreshold() {
        CellGrid grid = new CellGrid(3, 1, List.of(
                new CellColor(10, 20, 30, 255),
                new CellColor(250, 250, 250, 128),
                new CellColor(250, 0, 0, 0)
        ));
        Palette palette = MedianCut.quantizeCells(grid, 24);
        assertEquals(List.of(rgb(10, 20, 30)), palette.colors());
    }
}
