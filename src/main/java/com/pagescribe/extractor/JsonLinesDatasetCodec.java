package com.pagescribe.extractor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Line-delimited JSON encoding: one compact object per {@code \n}-terminated UTF-8 line, no header.
 * Reading is best-effort; a corrupt line (invalid UTF-8, malformed JSON, trailing content, not an object)
 * is skipped and the rest of the file is still read.
 */
public class JsonLinesDatasetCodec implements DatasetCodec {
    private static final Logger logger = LoggerFactory.getLogger(JsonLinesDatasetCodec.class);
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};
    // a line is one complete value; anything after it makes the line corrupt
    private static final ObjectReader LINE_READER = Json.MAPPER.reader()
        .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    @Override
    public DatasetFormat format() {
        return DatasetFormat.LINE_DELIMITED;
    }

    @Override
    public int read(Path path, Consumer<Map<String, Object>> rowConsumer) throws IOException {
        int rows = 0;
        int skipped = 0;
        int lineNo = 0;
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try (InputStream in = new BufferedInputStream(Files.newInputStream(path))) {
            byte[] raw;
            while ((raw = readLine(in)) != null) {
                lineNo++;
                String line;
                try {
                    line = decoder.decode(ByteBuffer.wrap(raw)).toString();
                } catch (CharacterCodingException e) {
                    skipped++;
                    logger.debug("Skipping line {} in {}: not valid UTF-8", lineNo, path);
                    continue;
                }
                String trimmed = line.strip();
                if (trimmed.isEmpty()) continue;
                try {
                    JsonNode node = LINE_READER.readTree(trimmed);
                    if (node == null || !node.isObject()) {
                        skipped++;
                        logger.debug("Skipping non-object line {} in {}", lineNo, path);
                        continue;
                    }
                    rowConsumer.accept(Json.MAPPER.convertValue(node, ROW_TYPE));
                    rows++;
                } catch (JsonProcessingException e) {
                    skipped++;
                    logger.debug("Skipping malformed line {} in {}: {}", lineNo, path, e.getOriginalMessage());
                }
            }
        }
        if (skipped > 0) {
            logger.warn("Skipped {} unreadable line(s) in {}", skipped, path);
        }
        return rows;
    }

    /**
     * Bytes of the next line without its terminator, or null at end of input.
     */
    private static byte[] readLine(InputStream in) throws IOException {
        ByteArrayOutputStream line = new ByteArrayOutputStream();
        int b;
        while ((b = in.read()) != -1) {
            if (b == '\n') {
                return line.toByteArray();
            }
            line.write(b);
        }
        return line.size() == 0 ? null : line.toByteArray();
    }

    @Override
    public boolean append(List<ExtractedRecord> records, Path path, boolean headerWritten) throws IOException {
        if (records.isEmpty()) {
            return headerWritten;
        }
        try (Writer out = DatasetFiles.openForAppend(path)) {
            for (ExtractedRecord r : records) {
                out.write(Json.MAPPER.writeValueAsString(r.fields()));
                out.write('\n');
            }
        }
        logger.debug("Appended {} lines to {}", records.size(), path);
        return headerWritten;
    }
}
