package com.monitintel.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.monitintel.core.state.TransitionOutcome;
import com.monitintel.core.util.JsonUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowContextTest {
    private static final Instant AT = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void criticalServicesKeepsOnlyNewAndChanged() {
        WorkflowContext context = WorkflowContext.of(AT, List.of(
                assessment("a", 1, TransitionOutcome.NEW),
                assessment("b", 1, TransitionOutcome.ONGOING),
                assessment("c", 3, TransitionOutcome.CHANGED),
                assessment("d", 0, TransitionOutcome.RECOVERED)
        ));

        assertEquals(List.of("a", "c"), context.criticalServices());
        assertTrue(context.hasCritical());
    }

    @Test
    void withLogsAttachesExcerptsByServiceName() {
        WorkflowContext context = WorkflowContext.of(AT, List.of(
                assessment("a", 1, TransitionOutcome.NEW),
                assessment("b", 0, TransitionOutcome.HEALTHY)
        ));

        WorkflowContext enriched = context.withLogs(Map.of(
                "a", LogExcerpt.of("a", LogStrategy.TAIL_FILE, "/var/log/a.log", List.of("boom"))
        ));

        assertEquals("boom", enriched.services().get("a").logExcerpt().orElseThrow().text());
        assertFalse(enriched.services().get("b").logExcerpt().isPresent());
        assertFalse(context.services().get("a").logExcerpt().isPresent());
    }

    @Test
    void serializedAssessmentsCarryCriticalFlag() throws Exception {
        JsonNode fresh = JsonUtils.objectMapper().readTree(JsonUtils.toJson(assessment("a", 1, TransitionOutcome.NEW)));
        JsonNode ongoing = JsonUtils.objectMapper().readTree(JsonUtils.toJson(assessment("b", 1, TransitionOutcome.ONGOING)));

        assertTrue(fresh.get("critical").asBoolean());
        assertFalse(ongoing.get("critical").asBoolean());
    }

    private ServiceAssessment assessment(String name, int status, TransitionOutcome outcome) {
        return new ServiceAssessment(name, status, outcome, new FailureState(name, status, AT, 1, AT, AT));
    }
}
