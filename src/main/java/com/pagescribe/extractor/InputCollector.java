package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the documents of an input root.
 */
public final class InputCollector {

    private InputCollector() {}

    /**
     * Walks {@code root} recursively and returns the regular files with one of the given extensions.
     * @param root input root
     * @param extensions accepted extensions without the dot, case-insensitive; empty accepts every file
     * @return sorted path strings, each prefixed by {@code root} as given
     * @throws IOException if the tree cannot be walked
     */
    public static List<String> collect(Path root, Collection<String> extensions) throws IOException {
        Set<String> accepted = extensions.stream()
            .map(e -> e.toLowerCase(Locale.ROOT).replaceFirst("^\\.", ""))
            .collect(Collectors.toSet());
        try (Stream<Path> files = Files.walk(root)) {
            return files
                .filter(Files::isRegularFile)
                .filter(p -> accepted.isEmpty() || accepted.contains(extension(p)))
                .map(Path::toString)
                .sorted()
                .collect(Collectors.toList());
        }
    }

    private static String extension(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
