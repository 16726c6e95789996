package com.flowmable.colormatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * File and AWT plumbing around {@link PixelBuffer}.
 * <p>
 * Decoding and encoding go through {@link ImageIO}. Alpha is discarded on
 * read; buffers are always written as opaque RGB.
 */
public final class PixelBufferIO {

    private static final Logger logger = LoggerFactory.getLogger(PixelBufferIO.class);

    private PixelBufferIO() {}

    /** Quality used for JPEG output. */
    public static final float JPEG_QUALITY = 0.95f;

    /** Side length references are shrunk to before their statistics are taken. */
    public static final int DEFAULT_REFERENCE_SIZE = 300;

    private static final List<String> IMAGE_EXTENSIONS = List.of(".jpg", ".jpeg", ".png");

    /**
     * Decode an image file.
     *
     * @throws IOException if the file can't be read or isn't a supported image
     */
    public static PixelBuffer read(Path file) throws IOException {
        BufferedImage image = ImageIO.read(file.toFile());
        if (image == null) {
            throw new IOException("Failed to decode image: " + file);
        }
        return fromImage(image);
    }

    /**
     * Encode a buffer, choosing the format from the file extension.
     *
     * @throws IOException if the extension is not supported or writing fails
     */
    public static void write(PixelBuffer buffer, Path file) throws IOException {
        String format = formatFor(file);
        BufferedImage image = toImage(buffer);

        if ("jpeg".equals(format)) {
            writeJpeg(image, file);
            return;
        }
        if (!ImageIO.write(image, format, file.toFile())) {
            throw new IOException("No writer for format " + format + ": " + file);
        }
    }

    public static PixelBuffer fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        byte[] data = new byte[w * h * PixelBuffer.RGB_CHANNELS];

        int idx = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int argb = image.getRGB(x, y);
                data[idx++] = (byte) ((argb >> 16) & 0xFF);
                data[idx++] = (byte) ((argb >> 8) & 0xFF);
                data[idx++] = (byte) (argb & 0xFF);
            }
        }
        return new PixelBuffer(w, h, PixelBuffer.RGB_CHANNELS, data);
    }

    public static BufferedImage toImage(PixelBuffer buffer) {
        buffer.requireValidRgb();
        int w = buffer.width();
        int h = buffer.height();
        byte[] data = buffer.data();
        BufferedImage image = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);

        int idx = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int r = data[idx++] & 0xFF;
                int g = data[idx++] & 0xFF;
                int b = data[idx++] & 0xFF;
                image.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    /**
     * Bilinear resize to exactly {@code width × height}.
     */
    public static PixelBuffer resize(PixelBuffer buffer, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidParameterException(String.format("Invalid target size %dx%d", width, height));
        }
        if (buffer.width() == width && buffer.height() == height) {
            return buffer;
        }
        BufferedImage src = toImage(buffer);
        BufferedImage dst = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = dst.createGraphics();
        g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2.drawImage(src, 0, 0, width, height, null);
        g2.dispose();
        return fromImage(dst);
    }

    /**
     * JPEG and PNG files directly inside {@code dir}, sorted by file name.
     */
    public static List<Path> listImages(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("Not a directory: " + dir);
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(PixelBufferIO::isImageFile)
                    .sorted()
                    .toList();
        }
    }

    /**
     * Load every image in {@code dir} as a reference, keyed by file name in
     * sorted order.
     * <p>
     * References are shrunk to {@code size × size} when {@code size > 0}; their
     * statistics don't depend on resolution. Files that fail to decode are
     * logged and left out.
     */
    public static Map<String, PixelBuffer> loadReferences(Path dir, int size) throws IOException {
        Map<String, PixelBuffer> references = new LinkedHashMap<>();
        for (Path file : listImages(dir)) {
            String name = file.getFileName().toString();
            PixelBuffer buffer;
            try {
                buffer = read(file);
            } catch (IOException e) {
                logger.warn("Skipping reference {}: {}", name, e.getMessage());
                continue;
            }
            references.put(name, size > 0 ? resize(buffer, size, size) : buffer);
        }
        logger.info("Loaded {} reference(s) from {}", references.size(), dir);
        return references;
    }

    static boolean isImageFile(Path file) {
        String n = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return IMAGE_EXTENSIONS.stream().anyMatch(n::endsWith);
    }

    private static String formatFor(Path file) throws IOException {
        String n = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (n.endsWith(".jpg") || n.endsWith(".jpeg")) return "jpeg";
        if (n.endsWith(".png")) return "png";
        if (n.endsWith(".bmp")) return "bmp";
        throw new IOException("Unsupported output format: " + file);
    }

    private static void writeJpeg(BufferedImage image, Path file) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpeg");
        if (!writers.hasNext()) {
            throw new IOException("No JPEG writer available");
        }
        ImageWriter writer = writers.next();
        ImageWriteParam param = writer.getDefaultWriteParam();
        param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
        param.setCompressionQuality(JPEG_QUALITY);

        Files.deleteIfExists(file);
        try (ImageOutputStream out = ImageIO.createImageOutputStream(file.toFile())) {
            if (out == null) {
                throw new IOException("Cannot open output stream: " + file);
            }
            writer.setOutput(out);
            writer.write(null, new IIOImage(image, null, null), param);
        } finally {
            writer.dispose();
        }
    }
}
