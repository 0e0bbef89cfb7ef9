package com.pagescribe.extractor;

import java.nio.file.Path;
import java.util.Locale;

/**
 * The two encodings a dataset file can have. A file never mixes them.
 */
public enum DatasetFormat {
    /** Flattened, delimiter-separated rows under a single header line. */
    TABLE("csv"),
    /** One independent JSON object per line, nested structure preserved. */
    LINE_DELIMITED("jsonl");

    private final String extension;

    DatasetFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Infers the format from a file extension.
     * @param path dataset path
     * @return the matching format
     * @throws UnsupportedDatasetFormatException if the extension is not recognised
     */
    public static DatasetFormat fromPath(Path path) {
        Path fileName = path == null ? null : path.getFileName();
        if (fileName == null) {
            throw new UnsupportedDatasetFormatException(String.valueOf(path));
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            throw new UnsupportedDatasetFormatException(name);
        }
        return fromName(name.substring(dot + 1));
    }

    /**
     * Parses a configured format name ({@code csv}, {@code .jsonl}, {@code table}, ...).
     * @param name format name or extension
     * @return the matching format
     * @throws UnsupportedDatasetFormatException if the name is not recognised
     */
    public static DatasetFormat fromName(String name) {
        if (name == null) {
            throw new UnsupportedDatasetFormatException("null");
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.startsWith(".")) key = key.substring(1);
        switch (key) {
            case "csv":
            case "table":
                return TABLE;
            case "jsonl":
            case "ndjson":
            case "line-delimited":
            case "line_delimited":
                return LINE_DELIMITED;
            default:
                throw new UnsupportedDatasetFormatException(name);
        }
    }
}
