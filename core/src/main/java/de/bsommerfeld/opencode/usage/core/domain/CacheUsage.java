package de.bsommerfeld.opencode.usage.core.domain;

/**
 * Prompt-cache token counts reported for a single step.
 *
 * @param write tokens written into the provider's prompt cache
 * @param read  tokens served from the provider's prompt cache
 */
public record CacheUsage(long write, long read) {

    public static final CacheUsage NONE = new CacheUsage(0, 0);
}
