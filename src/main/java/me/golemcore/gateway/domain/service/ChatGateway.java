package me.golemcore.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.gateway.domain.listener.AgentEventListener;
import me.golemcore.gateway.domain.listener.BackgroundProgressListener;
import me.golemcore.gateway.domain.listener.BackgroundProgressSettings;
import me.golemcore.gateway.domain.listener.InputRequestListener;
import me.golemcore.gateway.domain.listener.ProgressListener;
import me.golemcore.gateway.domain.model.AgentSession;
import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.ChatSessionBinding;
import me.golemcore.gateway.domain.model.ExecutionContext;
import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.domain.model.SessionPhase;
import me.golemcore.gateway.domain.model.TaskRecord;
import me.golemcore.gateway.domain.model.TaskResult;
import me.golemcore.gateway.domain.model.TaskStatus;
import me.golemcore.gateway.domain.model.TaskUpdate;
import me.golemcore.gateway.domain.model.UserInput;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.InboundMessageHandler;
import me.golemcore.gateway.port.outbound.AgentExecutionException;
import me.golemcore.gateway.port.outbound.AgentExecutorPort;
import me.golemcore.gateway.port.outbound.CompletionNotifier;
import me.golemcore.gateway.port.outbound.MessengerPort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Routes inbound chat messages to agent task runs, one run per chat at a time.
 *
 * <p>
 * For each message the gateway:
 * <ol>
 * <li>drops duplicates of recently seen message ids;</li>
 * <li>answers a pending external input request, if the chat has one;</li>
 * <li>injects the message into the running task of the chat, or</li>
 * <li>handles a control command ({@code /new}, {@code /reset},
 * {@code /status}, {@code /tasks}, {@code /task}), or</li>
 * <li>starts a new run on a worker thread and returns immediately.</li>
 * </ol>
 *
 * <p>
 * When a run ends waiting for user input the slot keeps its session and the
 * next message resumes it. Messages injected too late for the run are
 * reprocessed in order in that case, and discarded otherwise.
 */
@Service
@Slf4j
public class ChatGateway implements InboundMessageHandler, CompletionNotifier {

    private static final int TASK_LIST_LIMIT = 10;

    private final GatewayProperties properties;
    private final Clock clock;
    private final MessageDeduplicator deduplicator;
    private final SessionSlotRegistry slots;
    private final InputRelayService relays;
    private final TaskRegistry taskRegistry;
    private final ChatSessionBindingService bindings;
    private final AgentExecutorPort agentExecutor;
    private final MessengerPort messenger;
    private final GatewayWorkers workers;
    private final ScheduledExecutorService scheduler;
    private final BackgroundProgressSettings backgroundSettings;

    public ChatGateway(GatewayProperties properties, Clock clock, MessageDeduplicator deduplicator,
            SessionSlotRegistry slots, InputRelayService relays, TaskRegistry taskRegistry,
            ChatSessionBindingService bindings, AgentExecutorPort agentExecutor, MessengerPort messenger,
            GatewayWorkers workers, ScheduledExecutorService gatewayScheduler) {
        this.properties = properties;
        this.clock = clock;
        this.deduplicator = deduplicator;
        this.slots = slots;
        this.relays = relays;
        this.taskRegistry = taskRegistry;
        this.bindings = bindings;
        this.agentExecutor = agentExecutor;
        this.messenger = messenger;
        this.workers = workers;
        this.scheduler = gatewayScheduler;
        GatewayProperties.BackgroundProperties background = properties.getBackground();
        this.backgroundSettings = new BackgroundProgressSettings(
                background.getInterval(),
                background.getWindow(),
                background.getCodeAgentInterval(),
                new HashSet<>(background.getCodeAgentTypes()),
                background.getCompletionPollInterval(),
                background.getMaxLifetime());
    }

    @Override
    public void handle(InboundMessage message) {
        if (message == null || isBlank(message.chatId()) || isBlank(message.content())) {
            return;
        }
        if (!message.reprocessed() && deduplicator.isDuplicate(dedupKey(message))) {
            log.debug("[Gateway] Duplicate message {} in chat {} ignored", message.messageId(), message.chatId());
            return;
        }

        Optional<ChatCommand> command = ChatCommand.parse(message.content());
        if (command.isEmpty() && relays.tryResolve(message.chatId(), message.content().trim())) {
            return;
        }

        Runnable followUp;
        while (true) {
            SessionSlot slot = slots.getOrCreate(message.chatId());
            synchronized (slot) {
                if (slot.isEvicted()) {
                    continue;
                }
                slot.touch(clock.instant());
                if (slot.isRunning()) {
                    inject(slot.getInputQueue(), slot.getSessionId(), message);
                    return;
                }
                if (command.isPresent()) {
                    followUp = prepareCommand(slot, command.get(), message);
                } else {
                    startRun(slot, message);
                    return;
                }
            }
            break;
        }
        followUp.run();
    }

    @Override
    public void notifyCompletion(String taskId, TaskStatus status, String answer, String errorText,
            long tokensUsed) {
        if (isBlank(taskId)) {
            return;
        }
        TaskStatus terminal = status != null ? status : TaskStatus.COMPLETED;
        try {
            taskRegistry.updateStatus(taskId, terminal, TaskUpdate.builder()
                    .tokensUsed(tokensUsed)
                    .answerPreview(isBlank(answer) ? null : answer)
                    .error(isBlank(errorText) ? null : errorText)
                    .build());
        } catch (Exception e) { // NOSONAR - notification is best-effort
            log.warn("[Gateway] Failed to record completion of task {}: {}", taskId, e.getMessage());
        }
    }

    /**
     * Wait until every run and reprocessing unit started so far has finished.
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        return workers.awaitIdle(timeout);
    }

    private void inject(BlockingQueue<UserInput> queue, String sessionId, InboundMessage message) {
        UserInput input = new UserInput(message.content(), message.senderId(), message.messageId());
        if (!queue.offer(input)) {
            log.warn("[Gateway] Input queue full for session {}, message {} dropped", sessionId,
                    message.messageId());
            return;
        }
        log.info("[Gateway] Injected message into running session {}", sessionId);
        GatewayProperties.ReactionProperties reactions = properties.getReactions();
        if (reactions.isEnabled() && !isBlank(message.messageId()) && !isBlank(reactions.getAckEmoji())) {
            workers.submit("ack-reaction", () -> {
                try {
                    messenger.addReaction(message.chatId(), message.messageId(), reactions.getAckEmoji());
                } catch (Exception e) { // NOSONAR - reactions are cosmetic
                    log.debug("[Gateway] Failed to add ack reaction: {}", e.getMessage());
                }
            });
        }
    }

    private void startRun(SessionSlot slot, InboundMessage message) {
        String sessionId;
        boolean resume = false;
        if (slot.getPhase() == SessionPhase.AWAITING_INPUT && slot.getSessionId() != null) {
            sessionId = slot.getSessionId();
            resume = true;
        } else if (slot.getSessionId() != null) {
            sessionId = slot.getSessionId();
        } else {
            Optional<ChatSessionBinding> binding = slot.getLastSessionId() == null
                    ? bindings.find(message.channelType(), message.chatId())
                    : Optional.empty();
            if (binding.isPresent() && binding.get().awaitingInput()) {
                sessionId = binding.get().sessionId();
                resume = true;
            } else {
                sessionId = newSessionId(message.channelType());
            }
        }
        List<String> pendingOptions = slot.getPendingOptions();
        BlockingQueue<UserInput> queue = slot.begin(sessionId, properties.getSession().getInputCapacity());
        boolean resumeRun = resume;
        log.debug("[Gateway] Starting run for chat {} in session {} (resume={})", message.chatId(), sessionId,
                resume);
        workers.submit("run:" + message.chatId(),
                () -> runTask(slot, message, sessionId, queue, resumeRun, pendingOptions));
    }

    private void runTask(SessionSlot slot, InboundMessage message, String sessionId,
            BlockingQueue<UserInput> queue, boolean resume, List<String> pendingOptions) {
        RunOutcome outcome = RunOutcome.IDLE;
        try {
            outcome = executeRun(slot, message, sessionId, queue, resume, pendingOptions);
        } finally {
            completeRun(slot, message, sessionId, outcome);
        }
    }

    private RunOutcome executeRun(SessionSlot slot, InboundMessage message, String requestedSessionId,
            BlockingQueue<UserInput> queue, boolean resume, List<String> pendingOptions) {
        AgentSession session;
        try {
            session = agentExecutor.ensureSession(requestedSessionId);
        } catch (AgentExecutionException | RuntimeException e) {
            log.error("[Gateway] Failed to prepare session {} for chat {}", requestedSessionId, message.chatId(),
                    e);
            reply(message, GatewayReplies.sessionFailure(e));
            return RunOutcome.SESSION_FAILED;
        }
        String sessionId = requestedSessionId;
        if (session != null && !isBlank(session.id()) && !session.id().equals(requestedSessionId)) {
            log.info("[Gateway] Executor opened session {} instead of {} for chat {}", session.id(),
                    requestedSessionId, message.chatId());
            sessionId = session.id();
            synchronized (slot) {
                slot.adoptSessionId(sessionId);
            }
        }
        bindings.bind(message.channelType(), message.chatId(), sessionId, false);
        boolean resuming = resume || (session != null && session.isAwaitingUserInput());

        ProgressListener progress = null;
        AgentEventListener chain = AgentEventListener.NOOP;
        if (properties.getProgress().isEnabled()) {
            progress = new ProgressListener(chain, messenger, message.chatId(), message.messageId(), scheduler,
                    work -> workers.submit("progress-flush", work), clock, properties.getProgress().getMinInterval());
            chain = progress;
        }
        BackgroundProgressListener background = null;
        if (properties.getBackground().isEnabled()) {
            background = new BackgroundProgressListener(chain, messenger, taskRegistry, scheduler,
                    work -> workers.submit("background-progress", work), clock, backgroundSettings,
                    message.chatId(), message.senderId(), message.messageId());
            chain = background;
        }
        chain = new InputRequestListener(chain, relays, messenger, message.chatId(), message.messageId());

        String content = message.content();
        if (resuming) {
            String answer = InputReplyParser.resolveNumberedReply(content, pendingOptions);
            queue.offer(new UserInput(answer, message.senderId(), message.messageId()));
            content = "";
        }

        ExecutionContext context = new ExecutionContext(message.channelType(), message.chatId(),
                message.senderId(), message.messageId(), sessionId, message.group(), queue, this);
        TaskResult result = null;
        Exception failure = null;
        try {
            result = agentExecutor.executeTask(context, content, chain);
        } catch (AgentExecutionException | RuntimeException e) {
            log.error("[Gateway] Task failed for chat {} in session {}", message.chatId(), sessionId, e);
            failure = e;
        } finally {
            if (progress != null) {
                progress.close();
            }
            if (background != null) {
                background.release();
            }
        }

        boolean awaiting = failure == null && result != null && result.isAwaitingUserInput();
        slot.setPendingOptions(awaiting ? result.getAwaitOptions() : List.of());
        dispatchResult(message, GatewayReplies.taskReply(result, failure), progress, result);
        return awaiting ? RunOutcome.AWAITING_INPUT : RunOutcome.IDLE;
    }

    private void dispatchResult(InboundMessage message, String reply, ProgressListener progress,
            TaskResult result) {
        String progressMessageId = progress != null ? progress.getMessageId() : null;
        boolean delivered = false;
        if (progressMessageId != null) {
            try {
                messenger.updateMessage(message.chatId(), progressMessageId, reply);
                delivered = true;
            } catch (Exception e) { // NOSONAR - fall back to a new reply
                log.warn("[Gateway] Failed to turn progress message into reply, sending new one: {}",
                        e.getMessage());
            }
        }
        if (!delivered) {
            reply(message, reply);
        }
        if (result == null || result.getAttachments() == null) {
            return;
        }
        for (Attachment attachment : result.getAttachments()) {
            try {
                messenger.sendDocument(message.chatId(), message.messageId(), attachment);
            } catch (Exception e) { // NOSONAR - attachments are best-effort
                log.error("[Gateway] Failed to upload attachment '{}' to chat {}", attachment.name(),
                        message.chatId(), e);
            }
        }
    }

    private void completeRun(SessionSlot slot, InboundMessage message, String sessionId, RunOutcome outcome) {
        boolean awaiting = outcome == RunOutcome.AWAITING_INPUT;
        List<UserInput> leftovers;
        String boundSessionId;
        synchronized (slot) {
            boundSessionId = slot.getSessionId() != null ? slot.getSessionId() : sessionId;
            leftovers = slot.finish(awaiting, clock.instant());
        }
        if (outcome != RunOutcome.SESSION_FAILED) {
            bindings.bind(message.channelType(), message.chatId(), boundSessionId, awaiting);
        }
        if (leftovers.isEmpty()) {
            return;
        }
        if (!awaiting) {
            log.info("[Gateway] Discarded {} pending message(s) for chat {}", leftovers.size(), message.chatId());
            return;
        }
        workers.submit("reprocess:" + message.chatId(), () -> {
            for (UserInput input : leftovers) {
                log.info("[Gateway] Reprocessing message {} for chat {}", input.messageId(), message.chatId());
                handle(new InboundMessage(message.channelType(), message.chatId(), input.senderId(),
                        input.messageId(), input.content(), message.group(), true, clock.instant()));
            }
        });
    }

    /**
     * Apply the command to the slot while its monitor is held.
     *
     * @return outbound work to run after the monitor is released
     */
    private Runnable prepareCommand(SessionSlot slot, ChatCommand command, InboundMessage message) {
        switch (command.type()) {
            case NEW: {
                String sessionId = newSessionId(message.channelType());
                slot.startNewSession(sessionId);
                return () -> {
                    bindings.bind(message.channelType(), message.chatId(), sessionId, false);
                    log.info("[Gateway] Chat {} switched to new session {}", message.chatId(), sessionId);
                    reply(message, GatewayReplies.NEW_SESSION);
                };
            }
            case RESET: {
                String sessionId = slot.getSessionId() != null ? slot.getSessionId() : slot.getLastSessionId();
                if (sessionId == null) {
                    sessionId = bindings.find(message.channelType(), message.chatId())
                            .map(ChatSessionBinding::sessionId)
                            .orElse(null);
                }
                slot.reset();
                String target = sessionId;
                return () -> resetSession(target, message);
            }
            case STATUS: {
                SessionPhase phase = slot.getPhase();
                String sessionId = slot.getSessionId() != null ? slot.getSessionId() : slot.getLastSessionId();
                return () -> reply(message, GatewayReplies.status(phase, sessionId,
                        taskRegistry.countActive(message.chatId()), relays.pendingCount(message.chatId())));
            }
            case TASKS:
                return () -> reply(message, GatewayReplies.taskList(
                        taskRegistry.listByChat(message.chatId(), false, TASK_LIST_LIMIT), clock.instant()));
            case TASK: {
                String taskId = command.argument();
                return () -> {
                    Optional<TaskRecord> record = taskId.isEmpty() ? Optional.empty()
                            : taskRegistry.get(taskId).filter(found -> message.chatId().equals(found.getChatId()));
                    reply(message, record.map(found -> GatewayReplies.taskDetail(found, clock.instant()))
                            .orElseGet(() -> GatewayReplies.taskNotFound(taskId)));
                };
            }
            default:
                return () -> {
                };
        }
    }

    private void resetSession(String sessionId, InboundMessage message) {
        bindings.clear(message.channelType(), message.chatId());
        Optional<AgentExecutorPort.SessionResetter> resetter = agentExecutor.sessionResetter();
        if (resetter.isEmpty()) {
            reply(message, GatewayReplies.RESET_UNSUPPORTED);
            return;
        }
        if (sessionId == null) {
            reply(message, GatewayReplies.RESET_DONE);
            return;
        }
        try {
            resetter.get().resetSession(sessionId);
            log.info("[Gateway] Reset session {} for chat {}", sessionId, message.chatId());
            reply(message, GatewayReplies.RESET_DONE);
        } catch (AgentExecutionException | RuntimeException e) {
            log.error("[Gateway] Failed to reset session {}", sessionId, e);
            reply(message, "Failed to reset session: " + e.getMessage());
        }
    }

    private void reply(InboundMessage message, String text) {
        try {
            messenger.replyMessage(message.chatId(), message.messageId(), text);
        } catch (Exception e) { // NOSONAR - delivery is best-effort
            log.error("[Gateway] Failed to send reply to chat {}", message.chatId(), e);
        }
    }

    /**
     * Platforms number messages per chat, so the key carries channel and chat.
     */
    static String dedupKey(InboundMessage message) {
        if (isBlank(message.messageId())) {
            return null;
        }
        return message.channelType() + ":" + message.chatId() + ":" + message.messageId();
    }

    private static String newSessionId(String channelType) {
        String prefix = isBlank(channelType) ? "chat" : channelType;
        return prefix + "-" + UUID.randomUUID();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private enum RunOutcome {
        IDLE, AWAITING_INPUT, SESSION_FAILED
    }
}
