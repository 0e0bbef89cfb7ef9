package com.pagescribe.extractor;

/** Exception thrown when a dataset path or format name is neither a table nor a line-delimited dataset. */
public class UnsupportedDatasetFormatException extends RuntimeException {

    private final String requested;

    public UnsupportedDatasetFormatException(String requested) {
        super("Unsupported dataset format: " + requested);
        this.requested = requested;
    }

    public String getRequested() {
        return requested;
    }
}
