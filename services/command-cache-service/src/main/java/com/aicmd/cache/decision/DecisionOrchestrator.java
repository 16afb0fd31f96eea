package com.aicmd.cache.decision;

import com.aicmd.cache.cache.CommandCacheManager;
import com.aicmd.cache.cache.SimilarMatch;
import com.aicmd.cache.confidence.ConfidenceCalculator;
import com.aicmd.cache.confidence.ConfidenceService;
import com.aicmd.cache.interaction.CommandSource;
import com.aicmd.cache.interaction.ConfirmationResult;
import com.aicmd.cache.interaction.InteractionCollaborator;
import com.aicmd.cache.matching.QueryMatcher;
import com.aicmd.cache.repository.CacheEntry;
import com.aicmd.cache.resilience.DegradationController;
import com.aicmd.cache.safety.SafetyClassifier;
import com.aicmd.cache.safety.SafetyVerdict;
import com.aicmd.cache.translation.TranslationClient;
import com.aicmd.cache.translation.TranslationException;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for one query: looks the query up, picks AutoUse, Confirm or Translate, talks
 * to the user and the translation service, and feeds the answer back into the cache.
 *
 * <p>Every cache call goes through {@link DegradationController}, so a broken store only
 * ever costs the cache; the translation path keeps working. The only failure that reaches
 * the caller is a {@link TranslationException} when translation itself is needed and fails.
 */
@Service
public class DecisionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(DecisionOrchestrator.class);

    private final CommandCacheManager cacheManager;
    private final ConfidenceService confidenceService;
    private final ConfidenceCalculator confidenceCalculator;
    private final QueryMatcher queryMatcher;
    private final DecisionPolicy policy;
    private final DegradationController degradationController;
    private final TranslationClient translationClient;
    private final SafetyClassifier safetyClassifier;
    private final InteractionCollaborator interaction;
    private final MeterRegistry meterRegistry;

    public DecisionOrchestrator(
        CommandCacheManager cacheManager,
        ConfidenceService confidenceService,
        ConfidenceCalculator confidenceCalculator,
        QueryMatcher queryMatcher,
        DecisionPolicy policy,
        DegradationController degradationController,
        TranslationClient translationClient,
        SafetyClassifier safetyClassifier,
        InteractionCollaborator interaction,
        MeterRegistry meterRegistry
    ) {
        this.cacheManager = cacheManager;
        this.confidenceService = confidenceService;
        this.confidenceCalculator = confidenceCalculator;
        this.queryMatcher = queryMatcher;
        this.policy = policy;
        this.degradationController = degradationController;
        this.translationClient = translationClient;
        this.safetyClassifier = safetyClassifier;
        this.interaction = interaction;
        this.meterRegistry = meterRegistry;
    }

    public Decision decide(String query) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        String queryHash = queryMatcher.hash(query);

        Optional<CacheEntry> exact = degradationController.guard(
            "findExact",
            () -> cacheManager.findExact(query),
            Optional::empty
        );
        if (exact.isPresent()) {
            return counted(exactDecision(queryHash, exact.get()));
        }

        Optional<SimilarMatch> similar = degradationController.guard(
            "findSimilar",
            () -> cacheManager.findSimilar(query),
            Optional::empty
        );
        if (similar.isPresent() && policy.forSimilar(similar.get().similarity()) == DecisionAction.CONFIRM) {
            CacheEntry entry = similar.get().entry();
            return counted(new Decision(
                DecisionAction.CONFIRM,
                MatchKind.SIMILAR_MATCH,
                entry.getCommand(),
                CommandSource.SIMILAR_CACHE,
                queryHash,
                entry.getQueryHash(),
                confidenceCalculator.effective(entry),
                similar.get().similarity(),
                safetyClassifier.classify(entry.getCommand())
            ));
        }
        return counted(Decision.translate(queryHash));
    }

    public CommandResult handle(String query) {
        return handle(query, false);
    }

    /**
     * Runs the whole lifecycle for one query. With {@code forceTranslate} the cache is not
     * consulted; the translated command is still saved.
     */
    public CommandResult handle(String query, boolean forceTranslate) {
        if (forceTranslate) {
            if (query == null || query.isBlank()) {
                throw new IllegalArgumentException("query must not be blank");
            }
            meterRegistry.counter("aicmd_decision_total", "action", DecisionAction.TRANSLATE.tag()).increment();
            String command = translationClient.translate(query);
            save(query, command);
            return new CommandResult(
                command,
                CommandSource.TRANSLATION,
                DecisionAction.TRANSLATE,
                null,
                true,
                0.0,
                null,
                safetyClassifier.classify(command)
            );
        }

        Decision decision = decide(query);
        return switch (decision.action()) {
            case AUTO_USE -> autoUse(decision);
            case CONFIRM -> confirmCached(query, decision);
            case TRANSLATE -> translateAndOffer(query, decision);
        };
    }

    private CommandResult autoUse(Decision decision) {
        recordFeedback(decision.matchedHash(), true);
        return new CommandResult(
            decision.command(),
            decision.source(),
            DecisionAction.AUTO_USE,
            null,
            true,
            decision.confidence(),
            decision.similarity(),
            decision.safety()
        );
    }

    private CommandResult confirmCached(String query, Decision decision) {
        ConfirmationResult answer = interaction.confirm(
            decision.command(),
            decision.source(),
            decision.confidence(),
            decision.similarity()
        );
        switch (answer) {
            case CONFIRMED -> {
                recordFeedback(decision.matchedHash(), true);
                if (decision.matchKind() == MatchKind.SIMILAR_MATCH) {
                    save(query, decision.command());
                }
            }
            case REJECTED -> recordFeedback(decision.matchedHash(), false);
            case TIMED_OUT -> log.debug("confirmation timed out, no feedback recorded hash={}", decision.matchedHash());
        }
        return new CommandResult(
            decision.command(),
            decision.source(),
            DecisionAction.CONFIRM,
            answer,
            answer != ConfirmationResult.REJECTED,
            decision.confidence(),
            decision.similarity(),
            decision.safety()
        );
    }

    private CommandResult translateAndOffer(String query, Decision decision) {
        String command;
        try {
            command = translationClient.translate(query);
        } catch (TranslationException ex) {
            if (decision.hasCachedCommand()) {
                log.warn("translation failed, offering cached command hash={} error={}", decision.matchedHash(), ex.getMessage());
                return offer(decision.command(), CommandSource.EXACT_CACHE, decision.matchedHash(), decision.confidence(), decision.safety());
            }
            throw ex;
        }

        Optional<CacheEntry> saved = save(query, command);
        String savedHash = saved.map(CacheEntry::getQueryHash).orElse(null);
        double confidence = saved.map(CacheEntry::getConfidenceScore).orElse(0.0);
        return offer(command, CommandSource.TRANSLATION, savedHash, confidence, safetyClassifier.classify(command));
    }

    private CommandResult offer(String command, CommandSource source, String entryHash, double confidence, SafetyVerdict safety) {
        ConfirmationResult answer = interaction.confirm(command, source, confidence, null);
        if (entryHash != null && answer != ConfirmationResult.TIMED_OUT) {
            recordFeedback(entryHash, answer == ConfirmationResult.CONFIRMED);
        }
        return new CommandResult(
            command,
            source,
            DecisionAction.TRANSLATE,
            answer,
            answer != ConfirmationResult.REJECTED,
            confidence,
            null,
            safety
        );
    }

    private Optional<CacheEntry> save(String query, String command) {
        return degradationController.guard(
            "save",
            () -> Optional.of(cacheManager.save(query, command, null, null)),
            Optional::empty
        );
    }

    private void recordFeedback(String queryHash, boolean confirmed) {
        if (queryHash == null) {
            return;
        }
        degradationController.attempt("updateFeedback", () -> confidenceService.updateFeedback(queryHash, confirmed));
    }

    private Decision exactDecision(String queryHash, CacheEntry entry) {
        double confidence = confidenceCalculator.effective(entry);
        SafetyVerdict safety = safetyClassifier.classify(entry.getCommand());
        DecisionAction action = policy.forExact(confidence, safety.dangerous());
        return new Decision(
            action,
            MatchKind.EXACT_MATCH,
            entry.getCommand(),
            CommandSource.EXACT_CACHE,
            queryHash,
            entry.getQueryHash(),
            confidence,
            null,
            safety
        );
    }

    private Decision counted(Decision decision) {
        meterRegistry.counter("aicmd_decision_total", "action", decision.action().tag()).increment();
        log.debug(
            "decision action={} match={} hash={} confidence={} similarity={}",
            decision.action(),
            decision.matchKind(),
            decision.queryHash(),
            decision.confidence(),
            decision.similarity()
        );
        return decision;
    }
}
