package com.pagescribe.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dataset store: dispatches reads and appends to the codec for the file's {@link DatasetFormat}.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class DatasetService implements DatasetServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(DatasetService.class);

    private final Map<DatasetFormat, DatasetCodec> codecs = new EnumMap<>(DatasetFormat.class);

    public DatasetService() {
        this(TableDatasetCodec.DEFAULT_DELIMITER);
    }

    /**
     * @param delimiter cell delimiter for table datasets
     */
    public DatasetService(char delimiter) {
        register(new TableDatasetCodec(delimiter));
        register(new JsonLinesDatasetCodec());
    }

    private void register(DatasetCodec codec) {
        codecs.put(codec.format(), codec);
    }

    @Override
    public DatasetSummary load(Path path, DatasetFormat format) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new NoSuchFileException(String.valueOf(path), null, "dataset not found");
        }
        DatasetFormat effective = format != null ? format : DatasetFormat.fromPath(path);
        Set<String> identities = new LinkedHashSet<>();
        int rows = codec(effective).read(path, row -> {
            Object fileName = row.get(ExtractedRecord.FILE_NAME);
            if (fileName != null && !fileName.toString().isBlank()) {
                identities.add(fileName.toString());
            }
        });
        logger.info("Loaded {} dataset {}: {} rows, {} distinct file names", effective, path, rows, identities.size());
        return new DatasetSummary(effective, identities, rows);
    }

    @Override
    public boolean flush(List<ExtractedRecord> records, Path path, boolean headerWritten, DatasetFormat format) throws IOException {
        if (records == null) {
            throw new IllegalArgumentException("records cannot be null");
        }
        boolean after = codec(format).append(records, path, headerWritten);
        logger.info("Flushed {} record(s) to {}", records.size(), path);
        return after;
    }

    @Override
    public void copyDataset(Path src, Path dest) throws IOException {
        Path parent = dest.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.copy(src, dest);
        logger.info("Seeded {} from {}", dest, src);
    }

    @Override
    public List<Map<String, Object>> readRecords(Path path, DatasetFormat format) throws IOException {
        if (path == null || !Files.exists(path)) {
            throw new NoSuchFileException(String.valueOf(path), null, "dataset not found");
        }
        List<Map<String, Object>> rows = new ArrayList<>();
        codec(format != null ? format : DatasetFormat.fromPath(path)).read(path, rows::add);
        return rows;
    }

    private DatasetCodec codec(DatasetFormat format) {
        DatasetCodec codec = format == null ? null : codecs.get(format);
        if (codec == null) {
            throw new UnsupportedDatasetFormatException(String.valueOf(format));
        }
        return codec;
    }
}
