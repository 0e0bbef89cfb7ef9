package com.pagescribe.extractor;

/**
 * A document failure whose cause is systemic (quota, credentials, limits). Raised by {@link ExtractionTask}
 * instead of swallowing the error, and turned into a run abort by {@link ExtractionScheduler}.
 */
public class FatalExtractionException extends RuntimeException {

    private final String documentRef;

    public FatalExtractionException(String documentRef, Throwable cause) {
        super("Fatal error while extracting " + documentRef + ": " + cause.getMessage(), cause);
        this.documentRef = documentRef;
    }

    public String getDocumentRef() {
        return documentRef;
    }
}
