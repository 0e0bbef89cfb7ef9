package com.pagescribe.preprocess;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ImagePreprocessorTest {
    private final ImagePreprocessor preprocessor = new ImagePreprocessor();

    @TempDir
    Path dir;

    private static BufferedImage image(int w, int h) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                int v = x < w / 2 ? 60 : 180;
                img.setRGB(x, y, (v << 16) | (v << 8) | v);
            }
        }
        return img;
    }

    @Test
    void testResizeKeepsAspectRatio() {
        BufferedImage out = preprocessor.resize(image(400, 200), 100);
        assertEquals(100, out.getWidth());
        assertEquals(50, out.getHeight());
    }

    @Test
    void testSmallImagesAreNotUpscaled() {
        BufferedImage img = image(80, 60);
        assertSame(img, preprocessor.resize(img, 100));
    }

    @Test
    void testCropMargins() {
        BufferedImage out = preprocessor.cropMargins(image(100, 80), List.of(10, 5, 20, 15));
        assertEquals(70, out.getWidth());
        assertEquals(60, out.getHeight());
    }

    @Test
    void testOversizedMarginsLeaveOnePixel() {
        BufferedImage out = preprocessor.cropMargins(image(10, 10), List.of(50, 50, 50, 50));
        assertEquals(1, out.getWidth());
        assertEquals(1, out.getHeight());
    }

    @Test
    void testContrastFactorSpreadsChannels() {
        BufferedImage img = image(10, 10);
        assertSame(img, preprocessor.enhanceContrast(img, 1.0));

        BufferedImage out = preprocessor.enhanceContrast(img, 2.0);
        int dark = out.getRGB(0, 0) & 0xff;
        int light = out.getRGB(9, 0) & 0xff;
        assertTrue(dark < 60, "dark " + dark);
        assertTrue(light > 180, "light " + light);
    }

    @Test
    void testPreprocessProducesDecodablePng() throws Exception {
        Path file = dir.resolve("page.jpg");
        ImageIO.write(image(300, 150), "JPEG", file.toFile());

        PreprocessedImage out = preprocessor.preprocess(file, new ImageSettings(120, List.of(0, 0, 0, 0), 1.1, "PNG"));

        assertEquals("image/png", out.mimeType());
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(out.bytes()));
        assertEquals(120, decoded.getWidth());
        assertEquals(60, decoded.getHeight());
    }

    @Test
    void testJpegOutput() throws Exception {
        assertEquals("image/jpeg", preprocessor.encode(image(10, 10), "jpg").mimeType());
    }

    @Test
    void testUnknownOutputFormat() {
        assertThrows(IOException.class, () -> preprocessor.encode(image(10, 10), "WEBP"));
    }

    @Test
    void testMissingOrUndecodableFile() throws Exception {
        assertThrows(NoSuchFileException.class, () -> preprocessor.load(dir.resolve("nope.png")));
        Path junk = Files.writeString(dir.resolve("junk.png"), "not an image");
        assertThrows(IOException.class, () -> preprocessor.load(junk));
    }

    @Test
    void testSettingsRequireFourMargins() {
        assertThrows(IllegalArgumentException.class, () -> new ImageSettings(100, List.of(1, 2), 1.0, "PNG"));
        assertEquals(List.of(0, 0, 0, 0), new ImageSettings(100, null, 1.0, null).margins());
    }
}
