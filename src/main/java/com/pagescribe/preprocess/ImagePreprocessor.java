package com.pagescribe.preprocess;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Prepares a scanned page for extraction: load as RGB, downscale, crop margins, adjust contrast, encode.
 * <p>
 * Pure and CPU-bound. It is called from extraction worker threads, never from the thread draining results.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class ImagePreprocessor {
    private static final Logger logger = LoggerFactory.getLogger(ImagePreprocessor.class);

    private static final Map<String, String> MIME_TYPES = Map.of(
        "PNG", "image/png",
        "JPEG", "image/jpeg",
        "JPG", "image/jpeg",
        "TIFF", "image/tiff",
        "TIF", "image/tiff",
        "BMP", "image/bmp",
        "GIF", "image/gif"
    );

    /**
     * Runs the whole pipeline on one file.
     * @param path image file
     * @param settings preprocessing settings
     * @return encoded bytes and their MIME type
     * @throws IOException if the file is missing, cannot be decoded, or the output format has no encoder
     */
    public PreprocessedImage preprocess(Path path, ImageSettings settings) throws IOException {
        BufferedImage img = load(path);
        img = resize(img, settings.maxDim());
        img = cropMargins(img, settings.margins());
        img = enhanceContrast(img, settings.contrastFactor());
        PreprocessedImage out = encode(img, settings.outputFormat());
        logger.debug("Preprocessed {} -> {}x{} {} ({} bytes)", path, img.getWidth(), img.getHeight(),
            out.mimeType(), out.bytes().length);
        return out;
    }

    BufferedImage load(Path path) throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new NoSuchFileException(path.toString());
        }
        BufferedImage raw = ImageIO.read(path.toFile());
        if (raw == null) {
            throw new IOException("No image decoder for " + path);
        }
        return toRgb(raw);
    }

    /**
     * Downscales so the longest side is at most {@code maxDim}, keeping the aspect ratio.
     */
    BufferedImage resize(BufferedImage img, int maxDim) {
        int w = img.getWidth();
        int h = img.getHeight();
        int longest = Math.max(w, h);
        if (maxDim <= 0 || longest <= maxDim) {
            return img;
        }
        double scale = maxDim / (double) longest;
        int nw = Math.max(1, (int) (w * scale));
        int nh = Math.max(1, (int) (h * scale));
        BufferedImage out = new BufferedImage(nw, nh, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(img, 0, 0, nw, nh, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    /**
     * Crops {@code margins} (left, top, right, bottom) pixels. At least one pixel always remains.
     */
    BufferedImage cropMargins(BufferedImage img, List<Integer> margins) {
        int left = Math.max(0, margins.get(0));
        int top = Math.max(0, margins.get(1));
        int right = Math.max(0, margins.get(2));
        int bottom = Math.max(0, margins.get(3));
        if (left == 0 && top == 0 && right == 0 && bottom == 0) {
            return img;
        }
        left = Math.min(left, img.getWidth() - 1);
        top = Math.min(top, img.getHeight() - 1);
        int x2 = Math.max(img.getWidth() - right, left + 1);
        int y2 = Math.max(img.getHeight() - bottom, top + 1);
        return copy(img.getSubimage(left, top, x2 - left, y2 - top));
    }

    /**
     * Scales each channel's distance from the mean grey level by {@code factor}; 1.0 leaves the image as is.
     */
    BufferedImage enhanceContrast(BufferedImage img, double factor) {
        if (factor == 1.0) {
            return img;
        }
        int w = img.getWidth();
        int h = img.getHeight();
        int[] px = img.getRGB(0, 0, w, h, null, 0, w);
        double sum = 0;
        for (int p : px) {
            int r = (p >> 16) & 0xff, g = (p >> 8) & 0xff, b = p & 0xff;
            sum += 0.299 * r + 0.587 * g + 0.114 * b;
        }
        double mean = Math.round(sum / px.length);
        for (int i = 0; i < px.length; i++) {
            int p = px[i];
            int r = blend((p >> 16) & 0xff, mean, factor);
            int g = blend((p >> 8) & 0xff, mean, factor);
            int b = blend(p & 0xff, mean, factor);
            px[i] = (0xff << 24) | (r << 16) | (g << 8) | b;
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        out.setRGB(0, 0, w, h, px, 0, w);
        return out;
    }

    PreprocessedImage encode(BufferedImage img, String format) throws IOException {
        String key = format.toUpperCase(Locale.ROOT);
        String mime = MIME_TYPES.get(key);
        String writerName = key.equals("JPG") ? "JPEG" : key.equals("TIF") ? "TIFF" : key;
        ByteArrayOutputStream buf = new ByteArrayOutputStream();
        if (mime == null || !ImageIO.write(img, writerName, buf)) {
            throw new IOException("No image encoder for output format " + format);
        }
        return new PreprocessedImage(buf.toByteArray(), mime);
    }

    private static int blend(int channel, double mean, double factor) {
        long v = Math.round(mean + factor * (channel - mean));
        return (int) Math.max(0, Math.min(255, v));
    }

    private static BufferedImage toRgb(BufferedImage src) {
        if (src.getType() == BufferedImage.TYPE_INT_RGB) {
            return src;
        }
        return copy(src);
    }

    private static BufferedImage copy(BufferedImage src) {
        BufferedImage out = new BufferedImage(src.getWidth(), src.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.drawImage(src, 0, 0, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
