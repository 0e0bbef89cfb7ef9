package com.pagescribe.extractor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Turns document references into canonical identity strings for membership tests.
 * <p>
 * A reference may be absolute, relative to the working directory, or a bare name stored by an older run
 * relative to the input root. {@link #identityIds(String, Path)} therefore yields both the "as given" and
 * the "as if relative to root" identity, so an absolute input path and a bare stored name still meet.
 */
public final class PathIdentityResolver {

    public PathIdentityResolver() {}

    /**
     * Canonical absolute form of a path: {@code ~} expanded, {@code .}/{@code ..} removed and symlinks
     * resolved for the part of the path that exists. Missing trailing segments are kept as written.
     * @param path path as given
     * @return canonical absolute path string
     * @throws IOException if resolving an existing prefix fails
     */
    public String normalize(String path) throws IOException {
        return canonical(toPath(path)).toString();
    }

    /**
     * Identities of a single reference relative to {@code root}.
     * @param path reference as stored or presented
     * @param root configured input root
     * @return one or two identity strings; empty for a blank reference
     * @throws IOException if normalisation fails
     */
    public Set<String> identityIds(String path, Path root) throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        if (path == null || path.isBlank()) {
            return ids;
        }
        Path given = toPath(path.trim());
        ids.add(canonical(given).toString());
        if (root != null && !isUnderRoot(given, root)) {
            ids.add(canonical(expandHome(root).resolve(given)).toString());
        }
        return ids;
    }

    /**
     * Union of {@link #identityIds(String, Path)} over a collection.
     */
    public Set<String> buildIdentitySet(Collection<String> paths, Path root) throws IOException {
        Set<String> ids = new LinkedHashSet<>();
        for (String p : paths) {
            ids.addAll(identityIds(p, root));
        }
        return ids;
    }

    private boolean isUnderRoot(Path given, Path root) throws IOException {
        Path expandedRoot = expandHome(root);
        if (given.normalize().startsWith(expandedRoot.normalize())) {
            return true;
        }
        return given.isAbsolute() && canonical(given).startsWith(canonical(expandedRoot));
    }

    private static Path toPath(String path) throws IOException {
        try {
            return expandHome(Path.of(path));
        } catch (InvalidPathException e) {
            throw new IOException("Invalid path '" + path + "': " + e.getMessage(), e);
        }
    }

    private static Path expandHome(Path p) {
        String s = p.toString();
        if (s.equals("~") || s.startsWith("~/") || s.startsWith("~\\")) {
            return Path.of(System.getProperty("user.home") + s.substring(1));
        }
        return p;
    }

    private static Path canonical(Path p) throws IOException {
        Path absolute = p.toAbsolutePath().normalize();
        Path existing = absolute;
        while (existing != null && !Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (existing == null) {
            return absolute;
        }
        Path real = existing.toRealPath();
        return real.resolve(existing.relativize(absolute)).normalize();
    }
}
