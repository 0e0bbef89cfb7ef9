package com.pagescribe.extractor;

/**
 * Exception thrown when the remote generation service rejects a request or returns an unusable answer.
 * <p>
 * The message always carries the HTTP status and the status text reported by the service
 * (for example {@code RESOURCE_EXHAUSTED}) because {@link LexicalFatalErrorClassifier} works on that text.
 */
public class GenerationServiceException extends RuntimeException {

    private final int statusCode;
    private final String serviceStatus;

    public GenerationServiceException(String message) {
        super(message);
        this.statusCode = -1;
        this.serviceStatus = null;
    }

    public GenerationServiceException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
        this.serviceStatus = null;
    }

    public GenerationServiceException(int statusCode, String serviceStatus, String message) {
        super("HTTP " + statusCode + (serviceStatus == null ? "" : " " + serviceStatus) + ": " + message);
        this.statusCode = statusCode;
        this.serviceStatus = serviceStatus;
    }

    /** HTTP status of the failed call, or -1 when the failure happened after a successful response. */
    public int getStatusCode() {
        return statusCode;
    }

    public String getServiceStatus() {
        return serviceStatus;
    }
}
