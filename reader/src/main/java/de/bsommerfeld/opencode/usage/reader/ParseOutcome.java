package de.bsommerfeld.opencode.usage.reader;

import de.bsommerfeld.opencode.usage.core.domain.UsagePart;

import java.util.Objects;

/**
 * Result of classifying one part file. Exactly one of {@code part} and
 * {@code error} is set for {@link Status#RELEVANT} and
 * {@link Status#MALFORMED}; both are {@code null} for
 * {@link Status#IRRELEVANT}.
 */
public record ParseOutcome(Status status, UsagePart part, UsageParseException error) {

    public enum Status {
        /** Carries token data and must be aggregated. */
        RELEVANT,
        /** Valid part without token data, e.g. a {@code step-start}. */
        IRRELEVANT,
        /** Unreadable or broken JSON. */
        MALFORMED
    }

    private static final ParseOutcome IRRELEVANT_OUTCOME = new ParseOutcome(Status.IRRELEVANT, null, null);

    public ParseOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static ParseOutcome relevant(UsagePart part) {
        return new ParseOutcome(Status.RELEVANT, Objects.requireNonNull(part, "part"), null);
    }

    public static ParseOutcome irrelevant() {
        return IRRELEVANT_OUTCOME;
    }

    public static ParseOutcome malformed(UsageParseException error) {
        return new ParseOutcome(Status.MALFORMED, null, Objects.requireNonNull(error, "error"));
    }

    public boolean isRelevant() {
        return status == Status.RELEVANT;
    }
}
