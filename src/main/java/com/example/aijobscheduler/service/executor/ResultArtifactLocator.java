package com.example.aijobscheduler.service.executor;

import com.example.aijobscheduler.config.JobSchedulerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.Optional;

/**
 * Finds a result file a worker left on disk instead of returning its output.
 * <p>
 * Workers that write files name them {@code "<date> <slug> <time>.md"}. The newest match is
 * used only if it was modified no earlier than the configured window before the run started.
 * <p>
 * Legacy fallback for workers that only write files; disabled when no directory is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResultArtifactLocator {

    private final JobSchedulerProperties properties;

    public Optional<String> findRecentArtifact(String slug, Instant runStartedAt) {
        var config = properties.getWorker().getResultArtifacts();
        if (config.getDirectory() == null || config.getDirectory().isBlank()) {
            return Optional.empty();
        }

        var directory = Path.of(config.getDirectory());
        if (!Files.isDirectory(directory)) {
            log.warn("Result directory {} does not exist", directory);
            return Optional.empty();
        }

        var newest = findNewest(directory, "* " + slug + " *.md");
        if (newest.isEmpty()) {
            return Optional.empty();
        }

        var file = newest.get();
        var earliestAccepted = runStartedAt.minus(config.getWindow());
        try {
            var modifiedAt = Files.getLastModifiedTime(file).toInstant();
            if (modifiedAt.isBefore(earliestAccepted)) {
                log.warn("Result file {} was modified at {}, too long before the run started at {}",
                        file.getFileName(), modifiedAt, runStartedAt);
                return Optional.empty();
            }

            var content = Files.readString(file, StandardCharsets.UTF_8);
            log.info("Read output from result file {} ({} characters)", file.getFileName(), content.length());
            return Optional.of(content);
        } catch (IOException e) {
            log.warn("Failed to read result file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> findNewest(Path directory, String glob) {
        Path newest = null;
        FileTime newestTime = null;
        try (var files = Files.newDirectoryStream(directory, glob)) {
            for (var file : files) {
                var modified = Files.getLastModifiedTime(file);
                if (newestTime == null || modified.compareTo(newestTime) > 0) {
                    newest = file;
                    newestTime = modified;
                }
            }
        } catch (IOException e) {
            log.warn("Failed to scan result directory {}: {}", directory, e.getMessage());
            return Optional.empty();
        }
        return Optional.ofNullable(newest);
    }
}
