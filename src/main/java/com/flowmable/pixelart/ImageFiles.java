package com.flowmable.pixelart;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Source-file checks and output naming for converted images.
 */
public final class ImageFiles {

    public static final List<String> ACCEPTED_EXTENSIONS =
            List.of(".jpg", ".jpeg", ".png", ".gif", ".bmp", ".webp", ".svg");

    /** 10 MB. */
    public static final long MAX_FILE_BYTES = 10L * 1024 * 1024;

    public static final String OUTPUT_PREFIX = "pixel_";
    public static final String DEFAULT_OUTPUT_NAME = "pixel_art.png";

    private ImageFiles() {}

    public static boolean hasAcceptedExtension(String fileName) {
        String n = fileName.toLowerCase(Locale.ROOT);
        return ACCEPTED_EXTENSIONS.stream().anyMatch(n::endsWith);
    }

    /**
     * Reject files that are missing, not images by extension, or over 10 MB.
     *
     * @throws IOException describing why the file was rejected
     */
    public static void checkAccepted(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new IOException("Not a file: " + file);
        }
        String name = file.getFileName().toString();
        if (!hasAcceptedExtension(name)) {
            throw new IOException("Not a supported image format: " + name);
        }
        long size = Files.size(file);
        if (size > MAX_FILE_BYTES) {
            throw new IOException(String.format(Locale.ROOT, "File %s is too large (%.2fMB), limit is 10MB",
                    name, size / 1024.0 / 1024.0));
        }
    }

    /**
     * {@code pixel_<name>} for a named source, {@code pixel_art.png} otherwise.
     * The extension is forced to {@code .png} since output is always PNG.
     */
    public static String outputName(String sourceName) {
        if (sourceName == null || sourceName.isBlank()) {
            return DEFAULT_OUTPUT_NAME;
        }
        int dot = sourceName.lastIndexOf('.');
        String base = dot > 0 ? sourceName.substring(0, dot) : sourceName;
        return OUTPUT_PREFIX + base + ".png";
    }

    /**
     * {@code pixel_cat.png} → {@code pixel_cat_2.png}, {@code _3}, … until the
     * name is not in {@code taken}.
     */
    public static Path nextFreeName(Path target, Set<Path> taken) {
        String name = target.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        String ext = dot > 0 ? name.substring(dot) : "";
        Path candidate = target;
        for (int i = 2; taken.contains(candidate); i++) {
            candidate = target.resolveSibling(base + "_" + i + ext);
        }
        return candidate;
    }

    public static void writePng(BufferedImage image, Path target) throws IOException {
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available for " + target);
        }
    }
}
