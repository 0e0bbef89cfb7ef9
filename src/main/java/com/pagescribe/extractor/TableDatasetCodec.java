package com.pagescribe.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import com.opencsv.RFC4180Parser;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Delimited-table encoding written and read with OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Records are flattened with {@link RecordFlattener}; nested keys become dot-joined column names.</li>
 *   <li>The first flush writes the header: the union of the batch's columns in first-seen order.</li>
 *   <li>Later flushes align their cells to the header already in the file. Columns the header does not
 *       know are dropped and logged, since the header line is never rewritten.</li>
 *   <li>Cells are quoted only when they contain the delimiter, a quote or a line break.</li>
 * </ul>
 * The default delimiter is {@code $}, which natural-language content rarely contains.
 *
 * @author PageScribe Team
 * @since 1.0
 */
public class TableDatasetCodec implements DatasetCodec {
    private static final Logger logger = LoggerFactory.getLogger(TableDatasetCodec.class);

    public static final char DEFAULT_DELIMITER = '$';

    private final char delimiter;

    public TableDatasetCodec() {
        this(DEFAULT_DELIMITER);
    }

    public TableDatasetCodec(char delimiter) {
        this.delimiter = delimiter;
    }

    @Override
    public DatasetFormat format() {
        return DatasetFormat.TABLE;
    }

    @Override
    public int read(Path path, Consumer<Map<String, Object>> rowConsumer) throws IOException {
        try (CSVReader reader = openReader(Files.newBufferedReader(path, StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            if (header == null) {
                return 0;
            }
            int rows = 0;
            String[] line;
            while ((line = reader.readNext()) != null) {
                if (line.length == 1 && line[0].isEmpty()) {
                    continue; // blank line
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 0; i < header.length; i++) {
                    row.put(header[i], i < line.length ? line[i] : "");
                }
                rowConsumer.accept(row);
                rows++;
            }
            return rows;
        } catch (CsvValidationException e) {
            throw new IOException("Malformed table dataset " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean append(List<ExtractedRecord> records, Path path, boolean headerWritten) throws IOException {
        if (records.isEmpty()) {
            return true;
        }
        List<Map<String, Object>> flat = new ArrayList<>(records.size());
        for (ExtractedRecord r : records) flat.add(RecordFlattener.flatten(r.fields()));

        List<String> columns = headerWritten ? existingHeader(path) : null;
        // header flag may be true for a file that is still empty (earlier empty batch)
        boolean writeHeader = columns == null;
        if (writeHeader) {
            columns = unionOfColumns(flat);
        } else {
            warnAboutUnknownColumns(flat, columns, path);
        }

        try (Writer out = DatasetFiles.openForAppend(path);
             ICSVWriter writer = new CSVWriterBuilder(out)
                 .withSeparator(delimiter)
                 .withLineEnd("\n")
                 .build()) {
            if (writeHeader) {
                writer.writeNext(columns.toArray(String[]::new), false);
            }
            for (Map<String, Object> row : flat) {
                String[] cells = new String[columns.size()];
                for (int i = 0; i < cells.length; i++) {
                    cells[i] = cell(row.get(columns.get(i)));
                }
                writer.writeNext(cells, false);
            }
            writer.flush();
        }
        logger.debug("Appended {} rows to {}", records.size(), path);
        return true;
    }

    private List<String> existingHeader(Path path) throws IOException {
        if (DatasetFiles.isEmpty(path)) {
            return null;
        }
        try (CSVReader reader = openReader(Files.newBufferedReader(path, StandardCharsets.UTF_8))) {
            String[] header = reader.readNext();
            return header == null ? null : List.of(header);
        } catch (CsvValidationException e) {
            throw new IOException("Malformed header in " + path + ": " + e.getMessage(), e);
        }
    }

    private static List<String> unionOfColumns(List<Map<String, Object>> rows) {
        Set<String> columns = new LinkedHashSet<>();
        columns.add(ExtractedRecord.FILE_NAME);
        for (Map<String, Object> row : rows) columns.addAll(row.keySet());
        return new ArrayList<>(columns);
    }

    private static void warnAboutUnknownColumns(List<Map<String, Object>> rows, List<String> header, Path path) {
        Set<String> unknown = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            for (String key : row.keySet()) {
                if (!header.contains(key)) unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            logger.warn("Columns {} are not in the header of {} and were not written", unknown, path);
        }
    }

    private CSVReader openReader(Reader in) {
        RFC4180Parser parser = new RFC4180ParserBuilder().withSeparator(delimiter).build();
        return new CSVReaderBuilder(in).withCSVParser(parser).build();
    }

    /**
     * Renders one cell. {@code null} becomes empty, lists and other structures become compact JSON.
     */
    static String cell(Object value) throws JsonProcessingException {
        if (value == null) return "";
        if (value instanceof String || value instanceof Number || value instanceof Boolean || value instanceof Character) {
            return String.valueOf(value);
        }
        return Json.MAPPER.writeValueAsString(value);
    }
}
