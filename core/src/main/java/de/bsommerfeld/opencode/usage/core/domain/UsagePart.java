package de.bsommerfeld.opencode.usage.core.domain;

import java.util.Optional;

/**
 * One raw usage event as stored by OpenCode in a single {@code *.json} part
 * file. Only parts of type {@value #STEP_FINISH} carry token data.
 *
 * @param id        part identifier ({@code prt_...})
 * @param messageId owning message ({@code msg_...}), wire name {@code messageID}
 * @param sessionId owning session ({@code ses_...}), wire name {@code sessionID}
 * @param eventType part kind, wire name {@code type}
 * @param tokens    token counts, {@code null} for parts without usage data
 * @param cost      cost of the step in USD as reported by OpenCode
 */
public record UsagePart(
        String id,
        String messageId,
        String sessionId,
        String eventType,
        TokenUsage tokens,
        double cost) {

    /** The only part type that reports token usage. */
    public static final String STEP_FINISH = "step-finish";

    public Optional<TokenUsage> tokenUsage() {
        return Optional.ofNullable(tokens);
    }

    public boolean hasTokens() {
        return tokens != null;
    }
}
