package me.golemcore.gateway.domain.service;

import me.golemcore.gateway.domain.model.InputOption;
import me.golemcore.gateway.domain.model.InputResponse;
import me.golemcore.gateway.domain.model.PendingInputRelay;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InputReplyParserTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private static PendingInputRelay withOptions(InputOption... options) {
        return new PendingInputRelay("task-1", "req-1", "codex", List.of(options), null, NOW,
                NOW.plusSeconds(600));
    }

    @ParameterizedTest
    @ValueSource(strings = { "skip", "No", "CANCEL", "拒绝", " reject " })
    void shouldDeclineOnSkipKeywords(String reply) {
        InputResponse response = InputReplyParser.resolve(withOptions(), reply);

        assertFalse(response.approved());
        assertEquals("", response.optionId());
        assertEquals("task-1", response.taskId());
        assertEquals("req-1", response.requestId());
    }

    @Test
    void shouldMapSingleNumberToOption() {
        PendingInputRelay relay = withOptions(
                new InputOption("a", "Alpha", null),
                new InputOption("b", "Beta", "second"));

        InputResponse response = InputReplyParser.resolve(relay, "2");

        assertTrue(response.approved());
        assertEquals("b", response.optionId());
        assertEquals("Beta", response.message());
    }

    @Test
    void shouldSelectSeveralOptionsFromList() {
        PendingInputRelay relay = withOptions(
                new InputOption("a", "Alpha", null),
                new InputOption("b", "Beta", null),
                new InputOption("c", "Gamma", null));

        InputResponse response = InputReplyParser.resolve(relay, "3, 1");

        assertEquals("c,a", response.optionId());
        assertEquals("Gamma, Alpha", response.message());
    }

    @Test
    void shouldUseLabelWhenOptionHasNoId() {
        InputResponse response = InputReplyParser.resolve(withOptions(new InputOption(null, "Only", null)), "1");

        assertEquals("Only", response.optionId());
    }

    @Test
    void shouldTreatOutOfRangeNumberAsFreeText() {
        PendingInputRelay relay = withOptions(new InputOption("a", "Alpha", null));

        InputResponse response = InputReplyParser.resolve(relay, "1,5");

        assertTrue(response.approved());
        assertEquals("", response.optionId());
        assertEquals("1,5", response.message());
    }

    @Test
    void shouldMapPermissionDigitsWithoutOptions() {
        PendingInputRelay relay = withOptions();

        assertEquals(InputReplyParser.OPTION_APPROVE, InputReplyParser.resolve(relay, "1").optionId());
        InputResponse deny = InputReplyParser.resolve(relay, "2");
        assertFalse(deny.approved());
        assertEquals(InputReplyParser.OPTION_DENY, deny.optionId());
        assertEquals(InputReplyParser.OPTION_APPROVE_ALWAYS, InputReplyParser.resolve(relay, "3").optionId());
    }

    @Test
    void shouldPassFreeTextThrough() {
        InputResponse response = InputReplyParser.resolve(withOptions(), "  use the staging database ");

        assertTrue(response.approved());
        assertEquals("use the staging database", response.message());
    }

    @Test
    void shouldResolveNumberedReplyToLabels() {
        List<String> labels = List.of("red", "green", "blue");

        assertEquals("green", InputReplyParser.resolveNumberedReply("2", labels));
        assertEquals("blue, red", InputReplyParser.resolveNumberedReply("3,1", labels));
        assertEquals("4", InputReplyParser.resolveNumberedReply("4", labels));
        assertEquals("purple", InputReplyParser.resolveNumberedReply("purple", labels));
        assertEquals("2", InputReplyParser.resolveNumberedReply("2", List.of()));
    }

    @Test
    void shouldIgnoreRepeatedPicks() {
        assertEquals(List.of(2, 1), InputReplyParser.parseSelection("2,1,2", 3));
        assertTrue(InputReplyParser.parseSelection("0", 3).isEmpty());
        assertTrue(InputReplyParser.parseSelection("1 2", 3).isEmpty());
    }

    @Test
    void shouldFormatNumberedOptions() {
        assertEquals("1. yes\n2. no", InputReplyParser.formatNumberedOptions(List.of("yes", "no")));
    }
}
