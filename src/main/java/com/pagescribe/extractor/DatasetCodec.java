package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reads and appends one dataset encoding. Implementations never rewrite content already in the file.
 */
public interface DatasetCodec {

    DatasetFormat format();

    /**
     * Streams every readable row of a dataset file to {@code rowConsumer}.
     * @param path existing dataset file
     * @param rowConsumer receives one map per row; table rows are flat, line-delimited rows keep nesting
     * @return number of rows delivered
     * @throws IOException if the file cannot be read
     */
    int read(Path path, Consumer<Map<String, Object>> rowConsumer) throws IOException;

    /**
     * Appends records to the end of {@code path}, creating it if needed.
     * @param records batch to write, in the order given
     * @param path dataset file
     * @param headerWritten whether the file already carries its header
     * @return the header state after this append
     * @throws IOException if writing fails; rows written before the failure stay in the file
     */
    boolean append(List<ExtractedRecord> records, Path path, boolean headerWritten) throws IOException;
}
