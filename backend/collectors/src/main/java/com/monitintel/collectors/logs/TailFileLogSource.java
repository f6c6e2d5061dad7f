package com.monitintel.collectors.logs;

import com.monitintel.core.model.LogExcerpt;
import com.monitintel.core.model.LogFetchSpec;
import com.monitintel.core.model.LogStrategy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class TailFileLogSource implements LogSource {
    @Override
    public LogStrategy strategy() {
        return LogStrategy.TAIL_FILE;
    }

    @Override
    public LogExcerpt fetch(String serviceName, LogFetchSpec spec) {
        return tail(serviceName, strategy(), Path.of(spec.locator()), spec.maxLines());
    }

    static LogExcerpt tail(String serviceName, LogStrategy strategy, Path file, int maxLines) {
        String source = file.toString();
        if (!Files.exists(file)) {
            return LogExcerpt.empty(serviceName, strategy, source, "log file not found: " + source);
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            return LogExcerpt.empty(serviceName, strategy, source, "log file not readable: " + source);
        }
        try {
            List<String> lines = TailReader.lastLines(file, maxLines);
            if (lines.isEmpty()) {
                return LogExcerpt.empty(serviceName, strategy, source, "log file is empty: " + source);
            }
            return LogExcerpt.of(serviceName, strategy, source, lines);
        } catch (IOException e) {
            return LogExcerpt.empty(serviceName, strategy, source, "error reading " + source + ": " + e.getMessage());
        }
    }
}
