package me.golemcore.gateway.domain.listener;

import me.golemcore.gateway.domain.model.AgentEvent;
import me.golemcore.gateway.domain.model.AgentEventTypes;
import me.golemcore.gateway.domain.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentEventDecodingTest {

    @Test
    void shouldDecodeToolCompletionWithError() {
        ToolActivity activity = ToolActivity.decode(AgentEvent.of(AgentEventTypes.TOOL_COMPLETED, Map.of(
                "call_id", "c1", "tool_name", "bash", "duration_ms", "250", "error", "exit 1"))).orElseThrow();

        ToolActivity.ToolCompleted completed = assertInstanceOf(ToolActivity.ToolCompleted.class, activity);
        assertEquals(Duration.ofMillis(250), completed.duration());
        assertTrue(completed.errored());
    }

    @Test
    void shouldDropToolEventsWithoutCallId() {
        assertTrue(ToolActivity.decode(AgentEvent.of(AgentEventTypes.TOOL_STARTED,
                Map.of("tool_name", "bash"))).isEmpty());
        assertTrue(ToolActivity.decode(AgentEvent.of("llm.token", Map.of())).isEmpty());
        assertTrue(ToolActivity.decode(null).isEmpty());
    }

    @Test
    void shouldDefaultUnknownCompletionStatusToCompleted() {
        BackgroundSignal signal = BackgroundSignal.decode(AgentEvent.of(AgentEventTypes.BACKGROUND_COMPLETED,
                Map.of("task_id", "t1", "status", "exploded"))).orElseThrow();

        assertEquals(TaskStatus.COMPLETED, assertInstanceOf(BackgroundSignal.Completed.class, signal).status());
    }

    @Test
    void shouldTreatCompletionWithActiveStatusAsFinished() {
        BackgroundSignal running = BackgroundSignal.decode(AgentEvent.of(AgentEventTypes.BACKGROUND_COMPLETED,
                Map.of("task_id", "t1", "status", "running", "answer", "done"))).orElseThrow();
        BackgroundSignal waiting = BackgroundSignal.decode(AgentEvent.of(AgentEventTypes.BACKGROUND_COMPLETED,
                Map.of("task_id", "t2", "status", "waiting_input", "error", "worker lost"))).orElseThrow();
        BackgroundSignal cancelled = BackgroundSignal.decode(AgentEvent.of(AgentEventTypes.BACKGROUND_COMPLETED,
                Map.of("task_id", "t3", "status", "cancelled"))).orElseThrow();

        assertEquals(TaskStatus.COMPLETED, assertInstanceOf(BackgroundSignal.Completed.class, running).status());
        assertEquals(TaskStatus.FAILED, assertInstanceOf(BackgroundSignal.Completed.class, waiting).status());
        assertEquals(TaskStatus.CANCELLED, assertInstanceOf(BackgroundSignal.Completed.class, cancelled).status());
    }

    @Test
    void shouldReadProgressFields() {
        BackgroundSignal signal = BackgroundSignal.decode(AgentEvent.of(AgentEventTypes.BACKGROUND_PROGRESS,
                Map.of("task_id", "t1", "tokens_used", 42L, "files_touched", List.of("a.txt", " ", "b.txt"))))
                .orElseThrow();

        BackgroundSignal.Progress progress = assertInstanceOf(BackgroundSignal.Progress.class, signal);
        assertEquals(42L, progress.tokensUsed());
        assertEquals(List.of("a.txt", "b.txt"), progress.files());
        assertEquals("", progress.currentTool());
    }

    @Test
    void shouldIgnoreBackgroundEventsWithoutTaskId() {
        assertTrue(BackgroundSignal.decode(AgentEvent.of(AgentEventTypes.BACKGROUND_DISPATCHED,
                Map.of("agent_type", "codex"))).isEmpty());
    }

    @Test
    void shouldShortenCadenceForCodeAgents() {
        BackgroundProgressSettings settings = new BackgroundProgressSettings(Duration.ofMinutes(10),
                Duration.ofMinutes(10), Duration.ofMinutes(3), Set.of("codex"), Duration.ofSeconds(30),
                Duration.ofHours(4));

        assertEquals(Duration.ofMinutes(3), settings.cadenceFor(" Codex "));
        assertEquals(Duration.ofMinutes(10), settings.cadenceFor("writer"));
        assertEquals(Duration.ofMinutes(10), settings.cadenceFor(null));
    }
}
