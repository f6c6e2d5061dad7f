package com.monitintel.core.model;

import com.monitintel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LogFetchSpecTest {
    @Test
    void bindsHyphenatedStrategyNamesFromJson() throws Exception {
        LogFetchSpec spec = JsonUtils.objectMapper().readValue("""
                {"strategy":"newest-of-glob","locator":"/var/log/backup_*.log","maxLines":150}
                """, LogFetchSpec.class);

        assertEquals(LogStrategy.NEWEST_OF_GLOB, spec.strategy());
        assertEquals(150, spec.maxLines());
        assertFalse(spec.userJournal());
        assertTrue(JsonUtils.toJson(spec).contains("\"newest-of-glob\""));
    }

    @Test
    void acceptsLegacyUnderscoreNames() {
        assertEquals(LogStrategy.JOURNAL_QUERY, LogStrategy.fromConfigName("JOURNAL_QUERY"));
        assertEquals(LogStrategy.TAIL_FILE, LogStrategy.fromConfigName("tail_file"));
    }

    @Test
    void rejectsNonPositiveMaxLinesAndUnknownStrategies() {
        assertThrows(IllegalArgumentException.class, () -> LogFetchSpec.of(LogStrategy.TAIL_FILE, "/tmp/x.log", 0));
        assertThrows(IllegalArgumentException.class, () -> LogStrategy.fromConfigName("docker"));
    }

    @Test
    void emptyExcerptAlwaysCarriesReason() {
        LogExcerpt excerpt = new LogExcerpt("svc", LogStrategy.TAIL_FILE, "/tmp/x.log", List.of(), null);
        assertTrue(excerpt.isEmpty());
        assertFalse(excerpt.reason().isBlank());
    }
}
