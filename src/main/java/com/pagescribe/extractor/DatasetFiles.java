package com.pagescribe.extractor;

import java.io.IOException;
import java.io.Writer;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * File helpers shared by the dataset codecs.
 */
final class DatasetFiles {

    private DatasetFiles() {}

    /**
     * Opens {@code path} for appending. If an earlier, interrupted write left the file without a trailing
     * newline, a newline is written first so new rows never merge into a truncated one.
     */
    static Writer openForAppend(Path path) throws IOException {
        boolean needsNewline = Files.exists(path) && Files.size(path) > 0 && !endsWithNewline(path);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
            StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        if (needsNewline) writer.write('\n');
        return writer;
    }

    static boolean isEmpty(Path path) throws IOException {
        return !Files.exists(path) || Files.size(path) == 0;
    }

    private static boolean endsWithNewline(Path path) throws IOException {
        try (SeekableByteChannel ch = Files.newByteChannel(path, StandardOpenOption.READ)) {
            ch.position(ch.size() - 1);
            ByteBuffer last = ByteBuffer.allocate(1);
            ch.read(last);
            return last.get(0) == '\n';
        }
    }
}
