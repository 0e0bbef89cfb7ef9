package com.pagescribe.preprocess;

/**
 * Encoded page image ready to send to the generation service.
 *
 * @param bytes encoded image
 * @param mimeType MIME type of {@code bytes}
 */
public record PreprocessedImage(byte[] bytes, String mimeType) {}
