package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.InputOption;
import me.golemcore.gateway.domain.model.InputResponse;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.outbound.AgentExecutorPort;
import me.golemcore.gateway.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InputRelayServiceTest {

    private static final String CHAT = "chat-1";

    private MutableClock clock;
    private AgentExecutorPort agentExecutor;
    private AgentExecutorPort.ExternalInputResponder responder;
    private InputRelayService service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        GatewayProperties properties = new GatewayProperties();
        properties.getRelay().setTtl(Duration.ofMinutes(30));
        properties.getRelay().setMaxPerChat(4);
        properties.getRelay().setMaxChats(2);
        agentExecutor = mock(AgentExecutorPort.class);
        responder = mock(AgentExecutorPort.ExternalInputResponder.class);
        when(agentExecutor.externalInputResponder()).thenReturn(Optional.of(responder));
        service = new InputRelayService(agentExecutor, clock, properties);
    }

    @Test
    void shouldAnswerOldestRequestWithParsedReply() throws Exception {
        service.register(CHAT, "task-1", "req-1", "codex",
                List.of(new InputOption("a", "Alpha", null), new InputOption("b", "Beta", null)), null);
        service.register(CHAT, "task-2", "req-2", "codex", List.of(), "permission");

        assertTrue(service.tryResolve(CHAT, "2"));

        ArgumentCaptor<InputResponse> captor = ArgumentCaptor.forClass(InputResponse.class);
        verify(responder).replyExternalInput(captor.capture());
        assertEquals("task-1", captor.getValue().taskId());
        assertEquals("b", captor.getValue().optionId());
        assertEquals(1, service.pendingCount(CHAT));
    }

    @Test
    void shouldNotConsumeMessageWithoutPendingRequest() {
        assertFalse(service.tryResolve(CHAT, "hello"));
    }

    @Test
    void shouldLeaveRequestQueuedWhenExecutorCannotReply() {
        when(agentExecutor.externalInputResponder()).thenReturn(Optional.empty());
        service.register(CHAT, "task-1", "req-1", null, List.of(), null);

        assertFalse(service.tryResolve(CHAT, "yes"));
        assertEquals(1, service.pendingCount(CHAT));
    }

    @Test
    void shouldFallThroughWhenReplyFails() throws Exception {
        doThrow(new IllegalStateException("agent gone")).when(responder).replyExternalInput(any());
        service.register(CHAT, "task-1", "req-1", null, List.of(), null);

        assertFalse(service.tryResolve(CHAT, "1"));
    }

    @Test
    void shouldIgnoreExpiredRequests() {
        service.register(CHAT, "task-1", "req-1", null, List.of(), null);
        clock.advance(Duration.ofMinutes(31));

        assertFalse(service.tryResolve(CHAT, "1"));
    }

    @Test
    void shouldEvictChatWithStalestRequestOverCap() {
        service.register("chat-a", "t1", "r1", null, List.of(), null);
        clock.advance(Duration.ofSeconds(1));
        service.register("chat-b", "t2", "r2", null, List.of(), null);
        clock.advance(Duration.ofSeconds(1));
        service.register("chat-c", "t3", "r3", null, List.of(), null);

        assertEquals(2, service.chatCount());
        assertEquals(0, service.pendingCount("chat-a"));
        assertEquals(1, service.pendingCount("chat-c"));
    }

    @Test
    void shouldPruneExpiredRequestsAndEmptyChats() {
        service.register(CHAT, "task-1", "req-1", null, List.of(), null);
        clock.advance(Duration.ofMinutes(20));
        service.register("chat-2", "task-2", "req-2", null, List.of(), null);
        clock.advance(Duration.ofMinutes(15));

        InputRelayService.CleanupResult result = service.cleanup();

        assertEquals(1, result.expiredRelays());
        assertEquals(0, result.evictedChats());
        assertEquals(1, service.chatCount());
        assertEquals(1, service.pendingCount("chat-2"));
    }
}
