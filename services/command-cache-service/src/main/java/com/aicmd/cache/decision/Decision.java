package com.aicmd.cache.decision;

import com.aicmd.cache.interaction.CommandSource;
import com.aicmd.cache.safety.SafetyVerdict;

/**
 * Outcome of looking a query up in the cache.
 *
 * <p>{@code command} is the cached candidate. On a {@link DecisionAction#TRANSLATE} decision
 * it is only set for a low-confidence exact match, which serves as fallback when the
 * translation service fails. {@code similarity} is null unless the match is similar.
 */
public record Decision(
    DecisionAction action,
    MatchKind matchKind,
    String command,
    CommandSource source,
    String queryHash,
    String matchedHash,
    double confidence,
    Double similarity,
    SafetyVerdict safety
) {
    public static Decision translate(String queryHash) {
        return new Decision(
            DecisionAction.TRANSLATE,
            MatchKind.NO_MATCH,
            null,
            CommandSource.TRANSLATION,
            queryHash,
            null,
            0.0,
            null,
            SafetyVerdict.safe()
        );
    }

    public boolean hasCachedCommand() {
        return command != null;
    }
}
