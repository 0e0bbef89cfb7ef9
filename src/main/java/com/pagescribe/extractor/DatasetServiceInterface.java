package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Interface for reading and appending dataset files in either {@link DatasetFormat}.
 */
public interface DatasetServiceInterface {

    /**
     * Reads an existing dataset.
     * @param path dataset file
     * @param format encoding, or {@code null} to infer it from the file extension
     * @return format, raw {@code file_name} identities and row count
     * @throws java.nio.file.NoSuchFileException if the file does not exist
     * @throws UnsupportedDatasetFormatException if the format cannot be determined
     * @throws IOException on read failure
     */
    DatasetSummary load(Path path, DatasetFormat format) throws IOException;

    /**
     * Appends a batch. Never rewrites earlier content, so every completed flush survives a later crash.
     * @param records batch in completion order
     * @param path dataset file
     * @param headerWritten whether the file already has its header (table format only)
     * @param format encoding of the file
     * @return header state after the flush: always true for table, unchanged for line-delimited
     * @throws IOException on write failure
     */
    boolean flush(List<ExtractedRecord> records, Path path, boolean headerWritten, DatasetFormat format) throws IOException;

    /**
     * Byte-identical copy used to seed a continuation run's output file.
     * @param src existing dataset
     * @param dest new dataset path; must not exist yet
     * @throws IOException on copy failure
     */
    void copyDataset(Path src, Path dest) throws IOException;

    /**
     * Reads every row of a dataset.
     * @param path dataset file
     * @param format encoding, or {@code null} to infer it
     * @return rows in file order
     * @throws IOException on read failure
     */
    List<Map<String, Object>> readRecords(Path path, DatasetFormat format) throws IOException;
}
