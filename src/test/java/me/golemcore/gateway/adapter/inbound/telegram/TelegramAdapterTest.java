package me.golemcore.gateway.adapter.inbound.telegram;

import me.golemcore.gateway.domain.model.Attachment;
import me.golemcore.gateway.domain.model.InboundMessage;
import me.golemcore.gateway.infrastructure.config.GatewayProperties;
import me.golemcore.gateway.port.inbound.InboundMessageHandler;
import me.golemcore.gateway.port.outbound.MessengerException;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.TestObjectProvider;
import me.golemcore.gateway.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.longpolling.TelegramBotsLongPollingApplication;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramAdapterTest {

    private GatewayProperties properties;
    private TelegramBotsLongPollingApplication botsApplication;
    private InboundMessageHandler handler;
    private TelegramClient telegramClient;
    private MutableClock clock;
    private TelegramAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new GatewayProperties();
        properties.getTelegram().setEnabled(true);
        properties.getTelegram().setToken("test-token");
        botsApplication = mock(TelegramBotsLongPollingApplication.class);
        handler = mock(InboundMessageHandler.class);
        telegramClient = mock(TelegramClient.class);
        clock = MutableClock.atEpoch();
        adapter = new TelegramAdapter(properties, botsApplication, new TestObjectProvider<>(handler),
                TestObjects.objectMapper(), clock);
        adapter.setTelegramClient(telegramClient);
    }

    private static Update textUpdate(long chatId, long userId, int messageId, String text) {
        User user = mock(User.class);
        when(user.getId()).thenReturn(userId);
        Message message = mock(Message.class);
        when(message.getChatId()).thenReturn(chatId);
        when(message.getFrom()).thenReturn(user);
        when(message.getMessageId()).thenReturn(messageId);
        when(message.hasText()).thenReturn(text != null);
        when(message.getText()).thenReturn(text);
        Update update = mock(Update.class);
        when(update.hasMessage()).thenReturn(true);
        when(update.getMessage()).thenReturn(message);
        return update;
    }

    @Test
    void shouldForwardTextMessages() {
        adapter.consume(textUpdate(100L, 7L, 55, "hello gateway"));

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(handler).handle(captor.capture());
        InboundMessage message = captor.getValue();
        assertEquals("telegram", message.channelType());
        assertEquals("100", message.chatId());
        assertEquals("7", message.senderId());
        assertEquals("55", message.messageId());
        assertEquals("hello gateway", message.content());
        assertFalse(message.group());
        assertFalse(message.reprocessed());
        assertEquals(clock.instant(), message.receivedAt());
    }

    @Test
    void shouldMarkSupergroupMessages() {
        Update update = textUpdate(-100L, 7L, 1, "hi all");
        when(update.getMessage().isSuperGroupMessage()).thenReturn(true);

        adapter.consume(update);

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(handler).handle(captor.capture());
        assertTrue(captor.getValue().group());
    }

    @Test
    void shouldUseCaptionOfMediaMessages() {
        Update update = textUpdate(100L, 7L, 2, null);
        when(update.getMessage().getCaption()).thenReturn("see attached");

        adapter.consume(update);

        ArgumentCaptor<InboundMessage> captor = ArgumentCaptor.forClass(InboundMessage.class);
        verify(handler).handle(captor.capture());
        assertEquals("see attached", captor.getValue().content());
    }

    @Test
    void shouldIgnoreUpdatesWithoutContent() {
        Update callback = mock(Update.class);
        when(callback.hasMessage()).thenReturn(false);

        adapter.consume(callback);
        adapter.consume(textUpdate(100L, 7L, 3, null));

        verify(handler, never()).handle(any());
    }

    @Test
    void shouldKeepPollingWhenHandlerFails() {
        doThrow(new IllegalStateException("boom")).when(handler).handle(any());

        assertDoesNotThrow(() -> adapter.consume(textUpdate(100L, 7L, 4, "hello")));
    }

    @Test
    void shouldReplyAndReturnMessageId() throws Exception {
        Message sent = mock(Message.class);
        when(sent.getMessageId()).thenReturn(901);
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(sent);

        String id = adapter.replyMessage("100", "55", "answer");

        assertEquals("901", id);
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals("100", captor.getValue().getChatId());
        assertEquals("answer", captor.getValue().getText());
        assertEquals(Integer.valueOf(55), captor.getValue().getReplyToMessageId());
    }

    @Test
    void shouldTruncateOverlongText() {
        String text = TelegramAdapter.truncate("x".repeat(5000));

        assertEquals(TelegramAdapter.MAX_MESSAGE_LENGTH, text.length());
        assertTrue(text.endsWith("..."));
    }

    @Test
    void shouldWrapSendFailures() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("Forbidden"));

        assertThrows(MessengerException.class, () -> adapter.sendMessage("100", "hi"));
    }

    @Test
    void shouldTreatUnchangedEditAsSuccess() throws Exception {
        when(telegramClient.execute(any(EditMessageText.class)))
                .thenThrow(new TelegramApiException("Bad Request: message is not modified"));

        assertDoesNotThrow(() -> adapter.updateMessage("100", "901", "same"));
    }

    @Test
    void shouldFailEditOfMissingMessage() throws Exception {
        when(telegramClient.execute(any(EditMessageText.class)))
                .thenThrow(new TelegramApiException("Bad Request: message to edit not found"));

        assertThrows(MessengerException.class, () -> adapter.updateMessage("100", "901", "text"));
        assertThrows(MessengerException.class, () -> adapter.updateMessage("100", "not-a-number", "text"));
    }

    @Test
    void shouldWrapDocumentFailures() throws Exception {
        when(telegramClient.execute(any(SendDocument.class))).thenThrow(new TelegramApiException("Too big"));

        Attachment attachment = new Attachment("report.csv", "text/csv", new byte[] { 1, 2 });

        assertThrows(MessengerException.class, () -> adapter.sendDocument("100", "55", attachment));
    }

    @Test
    void shouldRegisterBotOnStart() throws Exception {
        adapter.start();

        verify(botsApplication).registerBot("test-token", adapter);
        assertTrue(adapter.isRunning());
    }

    @Test
    void shouldNotStartWhenDisabled() throws Exception {
        properties.getTelegram().setEnabled(false);

        adapter.start();

        verify(botsApplication, never()).registerBot(any(String.class), any());
        assertFalse(adapter.isRunning());
    }
}
