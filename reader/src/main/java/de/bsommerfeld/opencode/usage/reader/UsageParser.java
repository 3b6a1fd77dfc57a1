package de.bsommerfeld.opencode.usage.reader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Singleton;
import de.bsommerfeld.opencode.usage.core.domain.CacheUsage;
import de.bsommerfeld.opencode.usage.core.domain.TokenUsage;
import de.bsommerfeld.opencode.usage.core.domain.UsagePart;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Decodes OpenCode part files into {@link UsagePart} records.
 *
 * <h3>Wire format</h3>
 *
 * <pre>
 * {
 *   "id": "prt_...", "messageID": "msg_...", "sessionID": "ses_...",
 *   "type": "step-finish",
 *   "tokens": { "input": 26535, "output": 1322, "reasoning": 0,
 *               "cache": { "write": 0, "read": 24781 } },
 *   "cost": 0.0123
 * }
 * </pre>
 *
 * <h3>Defensive parsing</h3>
 * The storage directory holds every part OpenCode ever wrote: text, tool
 * calls, step starts and step finishes, some possibly half-written. Only
 * structurally broken content is an error:
 * <ul>
 * <li>invalid JSON, empty input, trailing garbage, a non-object root, or a
 * token counter that is not a non-negative integer fail with
 * {@link UsageParseException.Kind#JSON}</li>
 * <li>a valid object without {@code tokens}, or of a {@code type} other than
 * {@value UsagePart#STEP_FINISH}, is irrelevant: {@link Optional#empty()}</li>
 * <li>absent counters, cost or ids default to zero or the empty string</li>
 * </ul>
 */
@Singleton
public class UsageParser {

    /**
     * Jackson's {@link ObjectMapper} is thread-safe for reading, so one
     * instance serves every parse call.
     */
    private final ObjectMapper mapper;

    public UsageParser() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<UsagePart> parse(String json) throws UsageParseException {
        return parse(json.getBytes(StandardCharsets.UTF_8));
    }

    public Optional<UsagePart> parse(byte[] content) throws UsageParseException {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JsonProcessingException e) {
            throw new UsageParseException(UsageParseException.Kind.JSON,
                    "Invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UsageParseException(UsageParseException.Kind.JSON, "Invalid JSON: " + e.getMessage(), e);
        }

        if (root == null || root.isMissingNode()) {
            throw new UsageParseException(UsageParseException.Kind.JSON, "Invalid JSON: empty content");
        }
        if (!root.isObject()) {
            throw new UsageParseException(UsageParseException.Kind.JSON,
                    "Expected a JSON object but found " + root.getNodeType());
        }
        return toPart(root);
    }

    /**
     * Reads and parses a part file.
     *
     * @throws UsageParseException with {@link UsageParseException.Kind#IO} if
     *                             the file cannot be read
     */
    public Optional<UsagePart> parseFile(Path file) throws UsageParseException {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UsageParseException(UsageParseException.Kind.IO, "Failed to read file: " + file, e);
        }
        return parse(content);
    }

    /**
     * Same as {@link #parseFile} but never throws: the outcome tells the
     * caller whether to aggregate, ignore or report the file.
     */
    public ParseOutcome classify(Path file) {
        try {
            return parseFile(file).map(ParseOutcome::relevant).orElseGet(ParseOutcome::irrelevant);
        } catch (UsageParseException e) {
            return ParseOutcome.malformed(e);
        }
    }

    private Optional<UsagePart> toPart(JsonNode root) throws UsageParseException {
        JsonNode tokensNode = root.get("tokens");
        if (tokensNode == null || tokensNode.isNull()) {
            return Optional.empty();
        }

        String type = text(root, "type");
        if (!type.isEmpty() && !UsagePart.STEP_FINISH.equals(type)) {
            return Optional.empty();
        }

        return Optional.of(new UsagePart(
                text(root, "id"),
                text(root, "messageID"),
                text(root, "sessionID"),
                type,
                toTokens(tokensNode),
                cost(root)));
    }

    private TokenUsage toTokens(JsonNode tokens) throws UsageParseException {
        requireObject(tokens, "tokens");
        JsonNode cacheNode = tokens.get("cache");
        CacheUsage cache = CacheUsage.NONE;
        if (cacheNode != null && !cacheNode.isNull()) {
            requireObject(cacheNode, "tokens.cache");
            cache = new CacheUsage(counter(cacheNode, "write"), counter(cacheNode, "read"));
        }
        return new TokenUsage(
                counter(tokens, "input"),
                counter(tokens, "output"),
                counter(tokens, "reasoning"),
                cache);
    }

    /**
     * A non-negative whole number. Accepts {@code 12.0} since some writers
     * serialize integers as doubles.
     */
    private static long counter(JsonNode parent, String field) throws UsageParseException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return 0L;
        }
        long value;
        if (node.isIntegralNumber() && node.canConvertToLong()) {
            value = node.longValue();
        } else if (node.isFloatingPointNumber() && node.canConvertToExactIntegral() && node.canConvertToLong()) {
            value = node.longValue();
        } else {
            throw new UsageParseException(UsageParseException.Kind.JSON,
                    "Token counter '" + field + "' is not an integer: " + node);
        }
        if (value < 0) {
            throw new UsageParseException(UsageParseException.Kind.JSON,
                    "Token counter '" + field + "' is negative: " + value);
        }
        return value;
    }

    private static double cost(JsonNode root) throws UsageParseException {
        JsonNode node = root.get("cost");
        if (node == null || node.isNull()) {
            return 0.0;
        }
        if (!node.isNumber() || !Double.isFinite(node.doubleValue())) {
            throw new UsageParseException(UsageParseException.Kind.JSON, "Cost is not a number: " + node);
        }
        return node.doubleValue();
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        return (node == null || node.isNull()) ? "" : node.asText();
    }

    private static void requireObject(JsonNode node, String field) throws UsageParseException {
        if (!node.isObject()) {
            throw new UsageParseException(UsageParseException.Kind.JSON,
                    "'" + field + "' must be an object but was " + node.getNodeType());
        }
    }
}
