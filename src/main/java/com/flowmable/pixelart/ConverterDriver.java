package com.flowmable.pixelart;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * CLI driver: converts image files to gridded pixel art PNGs.
 * <p>
 * Usage: {@code ConverterDriver [--colors N] [--size N] [--out DIR] <image>...}
 */
public class ConverterDriver {

    record Options(ConversionSettings settings, Path outDir, List<Path> inputs) {}

    public static void main(String[] args) throws Exception {
        Options options;
        try {
            options = parseArgs(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
            return;
        }

        if (options.inputs().isEmpty()) {
            printUsage();
            System.exit(1);
            return;
        }

        ConversionSettings settings = options.settings();
        System.out.println("Colors: " + settings.colorCount()
                + ", max size: " + settings.maxSize()
                + ", block: " + settings.blockSize() + "px");

        int failures = convertAll(new PixelArtConverter(settings), options.inputs(), options.outDir());
        if (failures > 0) {
            System.exit(1);
        }
    }

    /**
     * Convert every input, reporting and skipping the ones that fail.
     *
     * @return number of inputs that were not converted
     */
    static int convertAll(PixelArtConverter converter, List<Path> inputs, Path outDir) {
        Set<Path> written = new HashSet<>();
        int failures = 0;
        for (Path input : inputs) {
            try {
                Path target = convertFile(converter, input, outDir, written);
                written.add(target);
                System.out.println("  wrote " + target);
            } catch (IOException | RuntimeException e) {
                failures++;
                System.err.println("  skipped " + input + ": " + e);
            }
        }
        return failures;
    }

    /**
     * @param taken Targets already written in this run; a clashing name gets a numeric suffix
     */
    static Path convertFile(PixelArtConverter converter, Path input, Path outDir, Set<Path> taken)
            throws IOException {
        ImageFiles.checkAccepted(input);

        long t0 = System.nanoTime();
        PixelArt art = converter.convert(input);
        BufferedImage image = PixelArtRenderer.renderToImage(art);
        long elapsed = (System.nanoTime() - t0) / 1_000_000;

        Path dir = outDir != null ? outDir : input.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path target = dir.resolve(ImageFiles.outputName(input.getFileName().toString())).toAbsolutePath();
        if (taken.contains(target)) {
            Path renamed = ImageFiles.nextFreeName(target, taken);
            System.err.println("  " + target.getFileName() + " already written this run, using " + renamed.getFileName());
            target = renamed;
        }
        ImageFiles.writePng(image, target);

        System.out.printf("%s: %dx%d cells, %s, %d ms%n",
                input.getFileName(),
                art.pixelWidth(), art.pixelHeight(),
                art.isQuantized() ? art.palette().size() + " colors" : "unquantized",
                elapsed);
        return target;
    }

    static Options parseArgs(String[] args) {
        String colors = null;
        String size = null;
        Path outDir = null;
        List<Path> inputs = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--colors" -> colors = value(args, ++i, arg);
                case "--size" -> size = value(args, ++i, arg);
                case "--out" -> outDir = Path.of(value(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    inputs.add(Path.of(arg));
                }
            }
        }
        return new Options(ConversionSettings.parse(colors, size), outDir, inputs);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[i];
    }

    private static void printUsage() {
        System.err.println("Usage: ConverterDriver [--colors N] [--size N] [--out DIR] <image>...");
        System.err.println("  --colors  palette size, 24-256 (default 24)");
        System.err.println("  --size    longest side in cells, 20-200 (default 80)");
    }
}
