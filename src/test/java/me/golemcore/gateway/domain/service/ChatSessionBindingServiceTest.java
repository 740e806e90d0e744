package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.ChatSessionBinding;
import me.golemcore.gateway.testsupport.InMemoryStorage;
import me.golemcore.gateway.testsupport.MutableClock;
import me.golemcore.gateway.testsupport.TestObjects;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChatSessionBindingServiceTest {

    private InMemoryStorage storage;
    private MutableClock clock;
    private ChatSessionBindingService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorage();
        clock = MutableClock.atEpoch();
        service = new ChatSessionBindingService(storage, TestObjects.objectMapper(), clock);
    }

    @Test
    void shouldPersistAndReloadBinding() {
        service.bind("telegram", "42", "telegram-abc", true);

        ChatSessionBindingService reloaded = new ChatSessionBindingService(storage, TestObjects.objectMapper(),
                clock);
        reloaded.init();

        ChatSessionBinding binding = reloaded.find("telegram", "42").orElseThrow();
        assertEquals("telegram-abc", binding.sessionId());
        assertTrue(binding.awaitingInput());
        assertEquals(clock.instant(), binding.updatedAt());
    }

    @Test
    void shouldIgnoreBlankSession() {
        service.bind("telegram", "42", " ", false);

        assertTrue(service.find("telegram", "42").isEmpty());
    }

    @Test
    void shouldDeleteFileOnClear() {
        service.bind("telegram", "42", "telegram-abc", false);

        service.clear("telegram", "42");

        assertTrue(service.find("telegram", "42").isEmpty());
        assertNull(storage.read(ChatSessionBindingService.DIRECTORY,
                ChatSessionBindingService.fileName("telegram", "42")));
    }

    @Test
    void shouldSkipUnreadableFilesOnLoad() {
        storage.write(ChatSessionBindingService.DIRECTORY, "broken.json", "{not json");
        service.bind("telegram", "7", "s-7", false);

        ChatSessionBindingService reloaded = new ChatSessionBindingService(storage, TestObjects.objectMapper(),
                clock);
        reloaded.init();

        assertTrue(reloaded.find("telegram", "7").isPresent());
    }

    @Test
    void shouldSanitizeFileNames() {
        assertEquals("telegram_-100_1.json", ChatSessionBindingService.fileName("telegram", "-100/1"));
    }
}
