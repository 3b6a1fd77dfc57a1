package de.bsommerfeld.opencode.usage.reader;

import de.bsommerfeld.opencode.usage.core.domain.CacheUsage;
import de.bsommerfeld.opencode.usage.core.domain.TokenUsage;
import de.bsommerfeld.opencode.usage.core.domain.UsagePart;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class UsageParserTest {

    private final UsageParser parser = new UsageParser();

    @TempDir
    Path tempDir;

    @Test
    void parse_shouldDecodeStepFinishPart() throws Exception {
        String json = """
                {
                  "id": "prt_1", "messageID": "msg_1", "sessionID": "ses_1",
                  "type": "step-finish",
                  "tokens": { "input": 26535, "output": 1322, "reasoning": 7,
                              "cache": { "write": 12, "read": 24781 } },
                  "cost": 0.0123
                }
                """;

        UsagePart part = parser.parse(json).orElseThrow();

        assertEquals("prt_1", part.id());
        assertEquals("msg_1", part.messageId());
        assertEquals("ses_1", part.sessionId());
        assertEquals(UsagePart.STEP_FINISH, part.eventType());
        assertEquals(new TokenUsage(26535, 1322, 7, new CacheUsage(12, 24781)), part.tokens());
        assertEquals(0.0123, part.cost(), 1e-12);
    }

    @Test
    void parse_shouldIgnorePartWithoutTokens() throws Exception {
        assertEquals(Optional.empty(), parser.parse("{\"id\":\"prt_1\",\"type\":\"text\",\"text\":\"hi\"}"));
    }

    @Test
    void parse_shouldIgnorePartWithNullTokens() throws Exception {
        assertEquals(Optional.empty(), parser.parse("{\"type\":\"step-finish\",\"tokens\":null}"));
    }

    @Test
    void parse_shouldIgnoreStepStartEvenWithTokens() throws Exception {
        String json = "{\"type\":\"step-start\",\"tokens\":{\"input\":5,\"output\":5}}";
        assertEquals(Optional.empty(), parser.parse(json));
    }

    @Test
    void parse_shouldAcceptTokensWithoutType() throws Exception {
        UsagePart part = parser.parse("{\"tokens\":{\"input\":3}}").orElseThrow();

        assertEquals("", part.eventType());
        assertEquals(3, part.tokens().input());
    }

    @Test
    void parse_shouldDefaultMissingFields() throws Exception {
        UsagePart part = parser.parse("{\"type\":\"step-finish\",\"tokens\":{}}").orElseThrow();

        assertEquals("", part.id());
        assertEquals(new TokenUsage(0, 0, 0, CacheUsage.NONE), part.tokens());
        assertEquals(0.0, part.cost());
    }

    @Test
    void parse_shouldDefaultMissingCacheToZero() throws Exception {
        UsagePart part = parser.parse("{\"tokens\":{\"input\":1,\"output\":2,\"reasoning\":3}}").orElseThrow();
        assertEquals(CacheUsage.NONE, part.tokens().cache());
    }

    @Test
    void parse_shouldAcceptIntegralDoubles() throws Exception {
        UsagePart part = parser.parse("{\"tokens\":{\"input\":12.0}}").orElseThrow();
        assertEquals(12, part.tokens().input());
    }

    @Test
    void parse_shouldFailOnMalformedJson() {
        UsageParseException e = assertThrows(UsageParseException.class,
                () -> parser.parse("{\"tokens\": {\"input\": 1"));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parse_shouldFailOnEmptyInput() {
        UsageParseException e = assertThrows(UsageParseException.class, () -> parser.parse(""));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parse_shouldFailOnTrailingGarbage() {
        UsageParseException e = assertThrows(UsageParseException.class,
                () -> parser.parse("{\"tokens\":{}} trailing"));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parse_shouldFailOnNonObjectRoot() {
        UsageParseException e = assertThrows(UsageParseException.class, () -> parser.parse("[1, 2, 3]"));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parse_shouldFailOnNegativeCounter() {
        UsageParseException e = assertThrows(UsageParseException.class,
                () -> parser.parse("{\"tokens\":{\"input\":-1}}"));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parse_shouldFailOnNonNumericCounter() {
        UsageParseException e = assertThrows(UsageParseException.class,
                () -> parser.parse("{\"tokens\":{\"output\":\"many\"}}"));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parse_shouldFailWhenTokensIsNotAnObject() {
        UsageParseException e = assertThrows(UsageParseException.class,
                () -> parser.parse("{\"tokens\":42}"));
        assertEquals(UsageParseException.Kind.JSON, e.getKind());
    }

    @Test
    void parseFile_shouldFailWithIoForMissingFile() {
        UsageParseException e = assertThrows(UsageParseException.class,
                () -> parser.parseFile(tempDir.resolve("missing.json")));
        assertEquals(UsageParseException.Kind.IO, e.getKind());
    }

    @Test
    void classify_shouldDistinguishAllOutcomes() throws Exception {
        Path relevant = Files.writeString(tempDir.resolve("a.json"), "{\"tokens\":{\"input\":1}}");
        Path irrelevant = Files.writeString(tempDir.resolve("b.json"), "{\"type\":\"text\"}");
        Path malformed = Files.writeString(tempDir.resolve("c.json"), "{");

        assertEquals(ParseOutcome.Status.RELEVANT, parser.classify(relevant).status());
        assertTrue(parser.classify(relevant).isRelevant());
        assertEquals(ParseOutcome.Status.IRRELEVANT, parser.classify(irrelevant).status());

        ParseOutcome broken = parser.classify(malformed);
        assertEquals(ParseOutcome.Status.MALFORMED, broken.status());
        assertNotNull(broken.error());
        assertNull(broken.part());
    }
}
