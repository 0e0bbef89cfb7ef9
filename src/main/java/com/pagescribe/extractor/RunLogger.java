package com.pagescribe.extractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Per-run log bound to a workspace's {@code run.log}.
 * <p>
 * Every line is {@code [yyyy-MM-ddTHH:mm:ss] message}; when an error is attached its full stack trace,
 * including the cause chain, follows on the next lines. Lines are mirrored to SLF4J so they also reach
 * the console. Worker threads log through the same instance, so writes are serialised.
 */
public class RunLogger {
    private static final Logger logger = LoggerFactory.getLogger("com.pagescribe.extractor.run");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Path logFile;
    private final Clock clock;

    public RunLogger(Path logFile) {
        this(logFile, Clock.systemDefaultZone());
    }

    public RunLogger(Path logFile, Clock clock) {
        this.logFile = logFile;
        this.clock = clock;
    }

    public Path logFile() {
        return logFile;
    }

    public void log(String message) {
        logger.info(message);
        append(line(message), null);
    }

    public void log(String message, Throwable error) {
        if (error == null) {
            log(message);
            return;
        }
        logger.error(message, error);
        append(line(message + ": " + error), error);
    }

    /** A warning line; used for observable-but-expected conditions such as partial coverage. */
    public void warn(String message) {
        logger.warn(message);
        append(line("WARNING: " + message), null);
    }

    private String line(String message) {
        String stamp = LocalDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(STAMP);
        return "[" + stamp + "] " + message + "\n";
    }

    private synchronized void append(String line, Throwable error) {
        StringBuilder text = new StringBuilder(line);
        if (error != null) {
            text.append(stackTrace(error));
        }
        try {
            Files.writeString(logFile, text, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write run log " + logFile, e);
        }
    }

    static String stackTrace(Throwable error) {
        StringWriter sw = new StringWriter();
        try (PrintWriter pw = new PrintWriter(sw)) {
            error.printStackTrace(pw);
        }
        return sw.toString();
    }
}
