package com.pagescribe.extractor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable result of extracting one document.
 * <p>
 * Field order is preserved, {@code file_name} is always present, nested objects are kept as nested maps.
 * Values may be {@code null} (an optional field the model left empty).
 */
public record ExtractedRecord(Map<String, Object> fields) {

    public static final String FILE_NAME = "file_name";
    public static final String GENERATION_SECONDS = "generation_seconds";

    public ExtractedRecord {
        if (fields == null || !(fields.get(FILE_NAME) instanceof String)) {
            throw new IllegalArgumentException("A record must carry a textual '" + FILE_NAME + "' field");
        }
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Builds a record from extracted fields and stamps the document reference onto it.
     * @param documentRef reference as presented to the extractor
     * @param extracted fields returned by the extractor (may be empty)
     * @return new record
     */
    public static ExtractedRecord of(String documentRef, Map<String, Object> extracted) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(FILE_NAME, documentRef);
        if (extracted != null) fields.putAll(extracted);
        // an extractor echoing its own file_name must not replace the reference we dispatched
        fields.put(FILE_NAME, documentRef);
        return new ExtractedRecord(fields);
    }
}
