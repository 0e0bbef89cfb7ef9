package com.pagescribe.extractor;

import java.nio.file.Path;

/**
 * Where the scheduler appends its flushes.
 *
 * @param path dataset file (may already contain a seeded copy of an earlier dataset)
 * @param format encoding of that file
 * @param headerWritten whether the file already carries its table header
 */
public record DatasetTarget(Path path, DatasetFormat format, boolean headerWritten) {}
