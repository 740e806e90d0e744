package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.SessionPhase;
import me.golemcore.gateway.domain.model.UserInput;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.BlockingQueue;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionSlotTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void shouldRefuseSecondRun() {
        SessionSlot slot = new SessionSlot("chat", NOW);
        slot.begin("s1", 4);

        assertThrows(IllegalStateException.class, () -> slot.begin("s2", 4));
    }

    @Test
    void shouldReturnUnconsumedInputsOnFinish() {
        SessionSlot slot = new SessionSlot("chat", NOW);
        BlockingQueue<UserInput> queue = slot.begin("s1", 4);
        queue.offer(new UserInput("late", "u1", "m2"));

        List<UserInput> leftovers = slot.finish(false, NOW.plusSeconds(5));

        assertEquals(1, leftovers.size());
        assertEquals(SessionPhase.IDLE, slot.getPhase());
        assertNull(slot.getInputQueue());
        assertNull(slot.getSessionId());
        assertEquals("s1", slot.getLastSessionId());
        assertEquals(NOW.plusSeconds(5), slot.getLastTouched());
    }

    @Test
    void shouldKeepSessionWhenAwaitingInput() {
        SessionSlot slot = new SessionSlot("chat", NOW);
        slot.begin("s1", 4);
        slot.setPendingOptions(List.of("a", "b"));

        slot.finish(true, NOW);

        assertEquals(SessionPhase.AWAITING_INPUT, slot.getPhase());
        assertEquals("s1", slot.getSessionId());
        assertEquals(List.of("a", "b"), slot.getPendingOptions());
    }

    @Test
    void shouldForgetSessionOnReset() {
        SessionSlot slot = new SessionSlot("chat", NOW);
        slot.startNewSession("s9");
        assertEquals("s9", slot.getSessionId());

        slot.reset();

        assertNull(slot.getSessionId());
        assertNull(slot.getLastSessionId());
        assertTrue(slot.getPendingOptions().isEmpty());
    }
}
