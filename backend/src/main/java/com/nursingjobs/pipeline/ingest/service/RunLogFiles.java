package com.nursingjobs.pipeline.ingest.service;

import com.nursingjobs.pipeline.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Stream;

/**
 * Per-stage log file naming, tailing and retention. The files themselves are written by the
 * Logback sifting appender keyed on {@link #MDC_KEY}.
 */
@Component
public class RunLogFiles {
    public static final String MDC_KEY = "stageLogFile";

    private static final Logger log = LoggerFactory.getLogger(RunLogFiles.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final PipelineProperties properties;
    private final Clock clock;

    public RunLogFiles(PipelineProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Path directory() {
        return Paths.get(properties.getLogs().getDirectory());
    }

    public Path stageLogFile(String employerSlug, String stage, Instant startedAt) {
        return directory().resolve(employerSlug + "_" + stage + "_" + STAMP.format(startedAt) + ".log");
    }

    /**
     * Last {@code lines} lines of the file, or an empty list when it does not exist yet.
     */
    public List<String> tail(Path file, int lines) {
        if (file == null || !Files.isRegularFile(file)) {
            return List.of();
        }
        try {
            List<String> all = Files.readAllLines(file, StandardCharsets.UTF_8);
            return List.copyOf(all.subList(Math.max(0, all.size() - Math.max(0, lines)), all.size()));
        } catch (IOException e) {
            log.warn("Could not read log file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    /**
     * Deletes {@code *.log} files in the log directory last modified more than
     * {@code retentionDays} ago.
     *
     * @return number of files deleted
     */
    public int purgeOlderThan(int retentionDays) {
        Path dir = directory();
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(Math.max(1, retentionDays)));
        int deleted = 0;
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".log")).toList()) {
                if (isOlderThan(file, cutoff) && deleteQuietly(file)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            log.warn("Could not list log directory {}: {}", dir, e.getMessage());
        }
        if (deleted > 0) {
            log.info("Purged {} log file(s) older than {} days from {}", deleted, retentionDays, dir);
        }
        return deleted;
    }

    private boolean isOlderThan(Path file, Instant cutoff) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isBefore(cutoff);
        } catch (IOException e) {
            log.debug("Skipping {}: {}", file, e.getMessage());
            return false;
        }
    }

    private boolean deleteQuietly(Path file) {
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete old log file {}: {}", file, e.getMessage());
            return false;
        }
    }
}
