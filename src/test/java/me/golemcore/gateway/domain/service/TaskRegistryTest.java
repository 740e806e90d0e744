package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.TaskRecord;
import me.golemcore.gateway.domain.model.TaskStatus;
import me.golemcore.gateway.domain.model.TaskUpdate;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.StoragePort;
import me.golemcore.gateway.testsupport.InMemoryStorage;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TaskRegistryTest {

    private static final String CHAT = "chat-1";

    private MutableClock clock;
    private InMemoryStorage storage;
    private GatewayProperties properties;
    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        storage = new InMemoryStorage();
        properties = new GatewayProperties();
        properties.getTasks().setRetention(Duration.ofHours(72));
        properties.getTasks().setMaxPerChat(2);
        registry = newRegistry();
    }

    private TaskRegistry newRegistry() {
        return new TaskRegistry(storage, TestObjects.objectMapper(), clock, properties);
    }

    private static TaskRecord task(String taskId, TaskStatus status) {
        return TaskRecord.builder().taskId(taskId).chatId(CHAT).agentType("codex").status(status).build();
    }

    @Test
    void shouldRejectRecordsWithoutIds() {
        assertThrows(IllegalArgumentException.class, () -> registry.save(task(" ", TaskStatus.RUNNING)));
        assertThrows(IllegalArgumentException.class,
                () -> registry.save(TaskRecord.builder().taskId("t1").build()));
        assertThrows(IllegalArgumentException.class, () -> registry.updateStatus("t1", null, TaskUpdate.none()));
        assertThrows(IllegalArgumentException.class,
                () -> registry.updateStatus("", TaskStatus.FAILED, TaskUpdate.none()));
    }

    @Test
    void shouldDefaultStatusAndPreserveCreationTime() {
        registry.save(TaskRecord.builder().taskId("t1").chatId(CHAT).build());
        Instant created = registry.get("t1").orElseThrow().getCreatedAt();

        clock.advance(Duration.ofMinutes(5));
        registry.save(task("t1", TaskStatus.RUNNING));

        TaskRecord record = registry.get("t1").orElseThrow();
        assertEquals(TaskStatus.RUNNING, record.getStatus());
        assertEquals(created, record.getCreatedAt());
        assertEquals(clock.instant(), record.getUpdatedAt());
    }

    @Test
    void shouldStampCompletionOnTerminalUpdate() {
        registry.save(task("t1", TaskStatus.RUNNING));
        clock.advance(Duration.ofMinutes(1));

        boolean updated = registry.updateStatus("t1", TaskStatus.COMPLETED, TaskUpdate.builder()
                .tokensUsed(1200L)
                .answerPreview("x".repeat(600))
                .build());

        TaskRecord record = registry.get("t1").orElseThrow();
        assertTrue(updated);
        assertEquals(clock.instant(), record.getCompletedAt());
        assertEquals(1200L, record.getTokensUsed());
        assertEquals(503, record.getAnswerPreview().length());
        assertFalse(registry.updateStatus("unknown", TaskStatus.FAILED, TaskUpdate.none()));
    }

    @Test
    void shouldKeepActiveRecordsAndNewestTerminalWithinChatCap() {
        registry.save(task("old-done", TaskStatus.COMPLETED));
        clock.advance(Duration.ofSeconds(1));
        registry.save(task("new-done", TaskStatus.FAILED));
        clock.advance(Duration.ofSeconds(1));
        registry.save(task("running", TaskStatus.RUNNING));

        List<String> ids = registry.listByChat(CHAT, false, 0).stream().map(TaskRecord::getTaskId).toList();

        assertEquals(List.of("running", "new-done"), ids);
    }

    @Test
    void shouldNeverEvictActiveRecordsEvenOverCap() {
        registry.save(task("a", TaskStatus.RUNNING));
        registry.save(task("b", TaskStatus.PENDING));
        registry.save(task("c", TaskStatus.WAITING_INPUT));

        assertEquals(3, registry.countActive(CHAT));
    }

    @Test
    void shouldDropTerminalRecordsPastRetention() {
        registry.save(task("done", TaskStatus.COMPLETED));
        clock.advance(Duration.ofHours(73));
        registry.save(TaskRecord.builder().taskId("other").chatId("chat-2").status(TaskStatus.RUNNING).build());

        assertTrue(registry.get("done").isEmpty());
        assertEquals(1, registry.size());
    }

    @Test
    void shouldFilterActiveAndLimitResults() {
        properties.getTasks().setMaxPerChat(10);
        registry = newRegistry();
        registry.save(task("t1", TaskStatus.COMPLETED));
        clock.advance(Duration.ofSeconds(1));
        registry.save(task("t2", TaskStatus.RUNNING));
        clock.advance(Duration.ofSeconds(1));
        registry.save(task("t3", TaskStatus.RUNNING));

        assertEquals(List.of("t3", "t2"),
                registry.listByChat(CHAT, true, 0).stream().map(TaskRecord::getTaskId).toList());
        assertEquals(1, registry.listByChat(CHAT, false, 1).size());
        assertTrue(registry.listByChat("", false, 0).isEmpty());
    }

    @Test
    void shouldNotLeaveTerminalStatusOnLateProgress() {
        registry.save(task("t1", TaskStatus.RUNNING));
        registry.updateStatus("t1", TaskStatus.COMPLETED, TaskUpdate.builder().answerPreview("done").build());
        Instant completedAt = registry.get("t1").orElseThrow().getCompletedAt();
        clock.advance(Duration.ofSeconds(5));

        boolean updated = registry.updateStatus("t1", TaskStatus.RUNNING, TaskUpdate.builder().tokensUsed(99L).build());

        TaskRecord record = registry.get("t1").orElseThrow();
        assertFalse(updated);
        assertEquals(TaskStatus.COMPLETED, record.getStatus());
        assertEquals(completedAt, record.getCompletedAt());
        assertEquals(0, registry.countActive(CHAT));
    }

    @Test
    void shouldKeepFirstTerminalStatusAndMergeLaterDetails() {
        registry.save(task("t1", TaskStatus.RUNNING));
        registry.updateStatus("t1", TaskStatus.COMPLETED, TaskUpdate.none());

        assertTrue(registry.updateStatus("t1", TaskStatus.FAILED, TaskUpdate.builder()
                .answerPreview("report ready")
                .tokensUsed(500L)
                .build()));

        TaskRecord record = registry.get("t1").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, record.getStatus());
        assertEquals("report ready", record.getAnswerPreview());
        assertEquals(500L, record.getTokensUsed());
    }

    @Test
    void shouldNotReopenTerminalRecordWhenSavedActive() {
        registry.save(task("t1", TaskStatus.FAILED).toBuilder().error("boom").build());
        Instant completedAt = registry.get("t1").orElseThrow().getCompletedAt();
        assertNotNull(completedAt);

        registry.save(task("t1", TaskStatus.RUNNING).toBuilder().description("retry").build());

        TaskRecord record = registry.get("t1").orElseThrow();
        assertEquals(TaskStatus.FAILED, record.getStatus());
        assertEquals(completedAt, record.getCompletedAt());
        assertEquals("boom", record.getError());
        assertEquals("retry", record.getDescription());
    }

    @Test
    void shouldDeleteRecordsCreatedBeforeCutoff() {
        registry.save(task("old", TaskStatus.RUNNING));
        clock.advance(Duration.ofHours(1));
        registry.save(task("new", TaskStatus.RUNNING));

        assertEquals(1, registry.deleteExpired(clock.instant().minus(Duration.ofMinutes(30))));
        assertTrue(registry.get("old").isEmpty());
    }

    @Test
    void shouldReloadSnapshotAndFailUnfinishedTasks() {
        registry.save(task("running", TaskStatus.RUNNING));
        registry.save(task("done", TaskStatus.COMPLETED));

        TaskRegistry restarted = newRegistry();
        restarted.init();

        TaskRecord stale = restarted.get("running").orElseThrow();
        assertEquals(TaskStatus.FAILED, stale.getStatus());
        assertEquals(TaskRegistry.RESTART_REASON, stale.getError());
        assertEquals(TaskStatus.COMPLETED, restarted.get("done").orElseThrow().getStatus());
    }

    @Test
    void shouldKeepUnfinishedTasksWhenStaleMarkingDisabled() {
        registry.save(task("running", TaskStatus.RUNNING));
        properties.getTasks().setMarkStaleOnStartup(false);

        TaskRegistry restarted = newRegistry();
        restarted.init();

        assertEquals(TaskStatus.RUNNING, restarted.get("running").orElseThrow().getStatus());
    }

    @Test
    void shouldKeepMemoryStateWhenPersistenceFails() {
        storage.failWrites(true);

        registry.save(task("t1", TaskStatus.RUNNING));

        assertEquals(1, registry.size());
        assertNull(storage.read(TaskRegistry.DIRECTORY, TaskRegistry.SNAPSHOT_FILE));
    }

    @Test
    void shouldReturnDefensiveCopies() {
        registry.save(task("t1", TaskStatus.RUNNING));

        registry.get("t1").orElseThrow().setStatus(TaskStatus.CANCELLED);

        assertEquals(TaskStatus.RUNNING, registry.get("t1").orElseThrow().getStatus());
    }

    @Test
    void shouldFoldWritesMadeDuringPendingSnapshotIntoOne() throws Exception {
        StoragePort slowStorage = mock(StoragePort.class);
        List<CompletableFuture<Void>> writes = new ArrayList<>();
        List<String> written = new ArrayList<>();
        when(slowStorage.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenAnswer(invocation -> {
                    written.add(invocation.getArgument(2));
                    CompletableFuture<Void> write = new CompletableFuture<>();
                    writes.add(write);
                    return write;
                });
        registry = new TaskRegistry(slowStorage, TestObjects.objectMapper(), clock, properties);

        registry.save(task("t1", TaskStatus.RUNNING));
        registry.updateStatus("t1", TaskStatus.WAITING_INPUT, TaskUpdate.none());
        registry.updateStatus("t1", TaskStatus.RUNNING, TaskUpdate.builder().tokensUsed(40L).build());

        assertEquals(1, writes.size());
        assertFalse(registry.awaitPersisted(Duration.ofMillis(10)));

        writes.get(0).complete(null);

        assertEquals(2, writes.size());
        assertTrue(written.get(1).contains("\"tokensUsed\":40"));
        writes.get(1).complete(null);
        assertTrue(registry.awaitPersisted(Duration.ofMillis(10)));
        verify(slowStorage, times(2)).putTextAtomic(anyString(), anyString(), anyString(), anyBoolean());
    }
}
