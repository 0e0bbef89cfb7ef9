package com.pagescribe.extractor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Reads text from a file path or, when no such file exists, from the classpath.
 */
final class ClasspathResources {

    private ClasspathResources() {}

    static String read(String location) throws IOException {
        if (location == null || location.isBlank()) {
            throw new NoSuchFileException("<blank resource location>");
        }
        Path file = Path.of(location);
        if (Files.isRegularFile(file)) {
            return Files.readString(file, StandardCharsets.UTF_8);
        }
        String name = location.startsWith("/") ? location.substring(1) : location;
        try (InputStream in = ClasspathResources.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new NoSuchFileException(location, null, "not a file and not on the classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
