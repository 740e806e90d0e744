package me.golemcore.gateway.domain.listener;

import me.golemcore.gateway.domain.model.AgentEvent;
import me.golemcore.gateway.domain.model.AgentEventTypes;
import me.golemcore.gateway.domain.model.InputOption;
import me.golemcore.gateway.domain.service.InputRelayService;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentExecutorPort;
import me.golemcore.gateway.port.outbound.MessengerException;
import me.golemcore.gateway.port.outbound.MessengerPort;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InputRequestListenerTest {

    private static final String CHAT = "chat-1";

    private MessengerPort messenger;
    private InputRelayService relays;
    private InputRequestListener listener;

    @BeforeEach
    void setUp() {
        messenger = mock(MessengerPort.class);
        relays = new InputRelayService(mock(AgentExecutorPort.class), MutableClock.atEpoch(),
                new GatewayProperties());
        listener = new InputRequestListener(null, relays, messenger, CHAT, "10");
    }

    @Test
    void shouldQueueRelayAndPromptChat() {
        listener.onEvent(AgentEvent.of(AgentEventTypes.INPUT_REQUESTED, Map.of(
                "task_id", "t1",
                "request_id", "r1",
                "agent_type", "codex",
                "summary", "Pick a target",
                "options", List.of(
                        Map.of("id", "prod", "label", "Production", "description", "live traffic"),
                        Map.of("id", "stage", "label", "Staging")))));

        assertEquals(1, relays.pendingCount(CHAT));
        verify(messenger).replyMessage(eq(CHAT), eq("10"), contains("1. Production - live traffic\n2. Staging"));
    }

    @Test
    void shouldIgnoreRequestsWithoutRequestId() {
        listener.onEvent(AgentEvent.of(AgentEventTypes.INPUT_REQUESTED, Map.of("task_id", "t1")));

        assertEquals(0, relays.pendingCount(CHAT));
        verify(messenger, never()).replyMessage(anyString(), anyString(), anyString());
    }

    @Test
    void shouldKeepRelayWhenPromptFails() {
        when(messenger.replyMessage(anyString(), anyString(), anyString()))
                .thenThrow(new MessengerException("blocked"));

        listener.onEvent(AgentEvent.of(AgentEventTypes.INPUT_REQUESTED,
                Map.of("task_id", "t1", "request_id", "r1")));

        assertEquals(1, relays.pendingCount(CHAT));
    }

    @Test
    void shouldExplainPermissionReplies() {
        String prompt = InputRequestListener.formatPrompt(
                new InputRequestSignal("t1", "r1", "", "Run rm -rf build?", List.of(), "permission"));

        assertTrue(prompt.startsWith("[Agent needs input] task t1\nRun rm -rf build?"));
        assertTrue(prompt.endsWith("Reply 1 to approve, 2 to deny, 3 to approve and remember."));
    }

    @Test
    void shouldAskForFreeTextWithoutOptions() {
        String prompt = InputRequestListener.formatPrompt(
                new InputRequestSignal("t1", "r1", "claude_code", "", List.of(), null));

        assertEquals("[claude_code needs input] task t1\n\nReply with your answer.", prompt);
    }

    @Test
    void shouldAcceptTypedOptions() {
        String prompt = InputRequestListener.formatPrompt(new InputRequestSignal("t1", "r1", "codex", "",
                List.of(new InputOption("a", "Alpha", null)), null));

        assertTrue(prompt.contains("1. Alpha\n"));
        assertTrue(prompt.endsWith("Reply with a number, or type your answer."));
    }
}
