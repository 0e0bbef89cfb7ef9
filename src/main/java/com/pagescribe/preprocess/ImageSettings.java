package com.pagescribe.preprocess;

import java.util.List;

/**
 * Settings for page preprocessing before the image is sent to the generation service.
 *
 * @param maxDim longest side in pixels after downscaling; images already smaller are left alone
 * @param margins pixels cropped from the left, top, right and bottom edge
 * @param contrastFactor 1.0 keeps the original contrast, larger values increase it
 * @param outputFormat encoder name, e.g. {@code PNG} or {@code JPEG}
 */
public record ImageSettings(int maxDim, List<Integer> margins, double contrastFactor, String outputFormat) {

    public ImageSettings {
        margins = margins == null || margins.isEmpty() ? List.of(0, 0, 0, 0) : List.copyOf(margins);
        if (margins.size() != 4) {
            throw new IllegalArgumentException("margins must have four values (left, top, right, bottom), got " + margins);
        }
        outputFormat = outputFormat == null || outputFormat.isBlank() ? "PNG" : outputFormat;
    }

    public static ImageSettings defaults() {
        return new ImageSettings(3000, List.of(0, 0, 0, 0), 1.0, "PNG");
    }
}
