package com.pagescribe.extractor;

import java.util.Map;

/**
 * The extraction function: turns one document into the fields of a record.
 * Calls may take arbitrarily long and may fail with any exception.
 */
@FunctionalInterface
public interface DocumentExtractor {

    /**
     * @param documentPath reference of the document, exactly as dispatched
     * @return extracted fields; nested objects as nested maps
     * @throws Exception on any failure
     */
    Map<String, Object> extract(String documentPath) throws Exception;
}
