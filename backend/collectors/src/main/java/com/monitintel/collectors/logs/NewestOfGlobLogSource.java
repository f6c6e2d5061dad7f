package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.attribute.FileTime;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Tails the most recently modified file matching a glob, for rotated or dated log sets such as
 * {@code backup_log_*.log}. Equal modification times resolve to the lexicographically
 * greatest path.
 */
public class NewestOfGlobLogSource implements LogSource {
    @Override
    public LogStrategy strategy() {
        return LogStrategy.NEWEST_OF_GLOB;
    }

    @Override
    public LogExcerpt fetch(String serviceName, LogFetchSpec spec) {
        String pattern = spec.locator();
        Optional<Path> newest;
        try {
            newest = newestMatch(pattern);
        } catch (IOException | UncheckedIOException e) {
            return LogExcerpt.empty(serviceName, strategy(), pattern, "error resolving " + pattern + ": " + e.getMessage());
        } catch (IllegalArgumentException e) {
            return LogExcerpt.empty(serviceName, strategy(), pattern, "invalid glob " + pattern + ": " + e.getMessage());
        }
        if (newest.isEmpty()) {
            return LogExcerpt.empty(serviceName, strategy(), pattern, "no files match " + pattern);
        }
        return TailFileLogSource.tail(serviceName, strategy(), newest.get(), spec.maxLines());
    }

    static Optional<Path> newestMatch(String pattern) throws IOException {
        GlobRoot root = GlobRoot.of(pattern);
        if (!Files.isDirectory(root.baseDirectory())) {
            return Optional.empty();
        }
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        try (Stream<Path> paths = Files.walk(root.baseDirectory(), root.depth())) {
            return paths
                    .filter(Files::isRegularFile)
                    .filter(matcher::matches)
                    .map(path -> new Candidate(path, lastModified(path)))
                    .max(Comparator.comparing(Candidate::modified).thenComparing(candidate -> candidate.path().toString()))
                    .map(Candidate::path);
        }
    }

    /**
     * Static directory prefix of a glob, used to check the pattern against allowed log roots.
     */
    static Path baseDirectory(String pattern) {
        return GlobRoot.of(pattern).baseDirectory();
    }

    private static FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private record Candidate(Path path, FileTime modified) {
    }

    /**
     * Directory to walk and how deep below it a match can sit.
     */
    private record GlobRoot(Path baseDirectory, int depth) {
        static GlobRoot of(String pattern) {
            String[] segments = pattern.split("/", -1);
            StringBuilder base = new StringBuilder();
            int firstGlob = segments.length;
            for (int i = 0; i < segments.length; i++) {
                if (isGlob(segments[i])) {
                    firstGlob = i;
                    break;
                }
            }
            if (firstGlob == segments.length) {
                // No wildcard: the pattern names a single file.
                firstGlob = segments.length - 1;
            }
            for (int i = 0; i < firstGlob; i++) {
                if (i > 0) {
                    base.append('/');
                }
                base.append(segments[i]);
            }
            String baseText = base.toString();
            if (baseText.isEmpty()) {
                baseText = pattern.startsWith("/") ? "/" : "";
            }
            int depth = segments.length - firstGlob;
            for (int i = firstGlob; i < segments.length; i++) {
                if (segments[i].contains("**")) {
                    depth = Integer.MAX_VALUE;
                    break;
                }
            }
            return new GlobRoot(Path.of(baseText), depth);
        }

        private static boolean isGlob(String segment) {
            return segment.indexOf('*') >= 0
                    || segment.indexOf('?') >= 0
                    || segment.indexOf('[') >= 0
                    || segment.indexOf('{') >= 0;
        }
    }
}
