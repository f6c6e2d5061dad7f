package com.monitintel.collectors.logs;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the last N lines of a stream in a bounded deque. Undecodable bytes are replaced
 * rather than failing the read.
 */
final class TailReader {
    static final int MAX_LINE_CHARS = 2_000;

    private TailReader() {
    }

    static List<String> lastLines(Path file, int maxLines) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return lastLines(in, maxLines);
        }
    }

    static List<String> lastLines(InputStream in, int maxLines) throws IOException {
        ArrayDeque<String> window = new ArrayDeque<>(Math.min(maxLines, 1_024));
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (window.size() == maxLines) {
                    window.removeFirst();
                }
                window.addLast(truncate(line));
            }
        }
        return new ArrayList<>(window);
    }

    static List<String> cap(List<String> lines, int maxLines) {
        if (lines.size() <= maxLines) {
            return lines;
        }
        return List.copyOf(lines.subList(lines.size() - maxLines, lines.size()));
    }

    private static String truncate(String line) {
        if (line.length() <= MAX_LINE_CHARS) {
            return line;
        }
        return line.substring(0, MAX_LINE_CHARS) + " [truncated]";
    }
}
