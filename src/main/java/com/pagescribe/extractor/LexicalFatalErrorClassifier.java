package com.pagescribe.extractor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Classifies failures by matching their text against markers of account, quota, auth and limit problems.
 * <p>
 * The text examined is {@code toString()} (class name and message) of the error and of every cause in its
 * chain, lower-cased. Matching is substring-based, so a change in the service's wording can silently turn a
 * fatal error into a document-local one.
 */
public class LexicalFatalErrorClassifier implements FatalErrorClassifier {

    public static final List<String> DEFAULT_MARKERS = List.of(
        "quota",
        "rate limit",
        "ratelimit",
        "rate_limit",
        "resource_exhausted",
        "resource exhausted",
        "too many requests",
        "permission",
        "permission_denied",
        "unauthorized",
        "unauthenticated",
        "forbidden",
        "api key not valid",
        "invalid api key",
        "api_key_invalid",
        "invalid credentials",
        "billing",
        "token limit",
        "context length",
        "context_length",
        "maximum context",
        "too many tokens"
    );

    private final List<String> markers;

    public LexicalFatalErrorClassifier() {
        this(List.of());
    }

    /**
     * @param extraMarkers additional markers, matched case-insensitively, on top of {@link #DEFAULT_MARKERS}
     */
    public LexicalFatalErrorClassifier(Collection<String> extraMarkers) {
        List<String> all = new ArrayList<>(DEFAULT_MARKERS);
        for (String m : extraMarkers) {
            if (m != null && !m.isBlank()) all.add(m.toLowerCase(Locale.ROOT));
        }
        this.markers = List.copyOf(all);
    }

    @Override
    public boolean isFatal(Throwable error) {
        String text = describe(error);
        for (String marker : markers) {
            if (text.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable error) {
        StringBuilder sb = new StringBuilder();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable t = error; t != null && seen.add(t); t = t.getCause()) {
            sb.append(t).append('\n');
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
