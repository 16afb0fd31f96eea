package com.aicmd.cache.cli;

import com.aicmd.cache.cache.CacheProperties;
import com.aicmd.cache.cache.CacheUnavailableException;
import com.aicmd.cache.cache.CommandCacheManager;
import com.aicmd.cache.confidence.ConfidenceService;
import com.aicmd.cache.confidence.ConfidenceStats;
import com.aicmd.cache.confidence.RecalculationResult;
import com.aicmd.cache.decision.CommandResult;
import com.aicmd.cache.decision.DecisionOrchestrator;
import com.aicmd.cache.matching.QueryMatcher;
import com.aicmd.cache.resilience.CacheDisabledException;
import com.aicmd.cache.resilience.CacheHealth;
import com.aicmd.cache.resilience.DegradationController;
import com.aicmd.cache.store.SchemaException;
import com.aicmd.cache.store.StoreMaintenanceService;
import com.aicmd.cache.store.StoreStats;
import com.aicmd.cache.store.StoreUnavailableException;
import com.aicmd.cache.translation.TranslationException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

@Component
public class CommandCacheRunner implements ApplicationRunner, ExitCodeGenerator {
    private static final Logger log = LoggerFactory.getLogger(CommandCacheRunner.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    static final String OPT_STATS = "stats";
    static final String OPT_CLEANUP = "cleanup-cache";
    static final String OPT_RECALCULATE = "recalculate-confidence";
    static final String OPT_RESET = "reset-cache-errors";
    static final String OPT_BACKUP = "backup";
    static final String OPT_FORCE_API = "force-api";

    private final DecisionOrchestrator orchestrator;
    private final CommandCacheManager cacheManager;
    private final ConfidenceService confidenceService;
    private final StoreMaintenanceService maintenance;
    private final DegradationController degradationController;
    private final QueryMatcher queryMatcher;
    private final CacheProperties cacheProperties;
    private final PrintStream out;
    private final PrintStream err;

    private int exitCode = EXIT_OK;

    @Autowired
    public CommandCacheRunner(
        DecisionOrchestrator orchestrator,
        CommandCacheManager cacheManager,
        ConfidenceService confidenceService,
        StoreMaintenanceService maintenance,
        DegradationController degradationController,
        QueryMatcher queryMatcher,
        CacheProperties cacheProperties
    ) {
        this(
            orchestrator,
            cacheManager,
            confidenceService,
            maintenance,
            degradationController,
            queryMatcher,
            cacheProperties,
            System.out,
            System.err
        );
    }

    CommandCacheRunner(
        DecisionOrchestrator orchestrator,
        CommandCacheManager cacheManager,
        ConfidenceService confidenceService,
        StoreMaintenanceService maintenance,
        DegradationController degradationController,
        QueryMatcher queryMatcher,
        CacheProperties cacheProperties,
        PrintStream out,
        PrintStream err
    ) {
        this.orchestrator = orchestrator;
        this.cacheManager = cacheManager;
        this.confidenceService = confidenceService;
        this.maintenance = maintenance;
        this.degradationController = degradationController;
        this.queryMatcher = queryMatcher;
        this.cacheProperties = cacheProperties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean maintenanceRequested = false;
        if (args.containsOption(OPT_RESET)) {
            degradationController.reset();
            err.println("cache error state reset");
            maintenanceRequested = true;
        }
        if (args.containsOption(OPT_CLEANUP)) {
            maintenanceRequested = true;
            runMaintenance("cleanup", () -> {
                int removed = cacheManager.cleanup();
                out.println("removed " + removed + " cache entries");
                return null;
            });
        }
        if (args.containsOption(OPT_RECALCULATE)) {
            maintenanceRequested = true;
            runMaintenance("recalculateAll", () -> {
                RecalculationResult result = confidenceService.recalculateAll();
                out.println(String.format(
                    Locale.ROOT,
                    "recalculated %d entries: %d updated, %d failed",
                    result.processed(),
                    result.updated(),
                    result.failed()
                ));
                if (result.failed() > 0) {
                    exitCode = EXIT_FAILED;
                }
                return null;
            });
        }
        if (args.containsOption(OPT_BACKUP)) {
            maintenanceRequested = true;
            runMaintenance("backup", () -> {
                Path target = maintenance.backup();
                out.println("backup written to " + target);
                return null;
            });
        }
        if (args.containsOption(OPT_STATS)) {
            maintenanceRequested = true;
            printStats();
        }

        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            if (!maintenanceRequested) {
                err.println("usage: ai [--force-api] <request...> | --stats | --cleanup-cache | "
                    + "--recalculate-confidence | --reset-cache-errors | --backup");
                exitCode = EXIT_USAGE;
            }
            return;
        }
        answer(String.join(" ", words), args.containsOption(OPT_FORCE_API));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void answer(String query, boolean forceTranslate) {
        if (cacheProperties.isCleanupOnStartup()) {
            degradationController.attempt("cleanup", cacheManager::cleanup);
        }
        if (log.isDebugEnabled()) {
            log.debug("query parameters={}", queryMatcher.extractParameters(query));
        }
        CommandResult result;
        try {
            result = orchestrator.handle(query, forceTranslate);
        } catch (TranslationException ex) {
            log.error("translation failed: {}", ex.getMessage());
            exitCode = EXIT_FAILED;
            return;
        }
        for (String warning : result.safety().warnings()) {
            err.println(warning);
        }
        if (!result.accepted()) {
            err.println("command not used");
            exitCode = EXIT_FAILED;
            return;
        }
        out.println(result.command());
    }

    private void runMaintenance(String operation, Supplier<Void> task) {
        try {
            degradationController.execute(operation, task);
        } catch (CacheDisabledException | CacheUnavailableException | StoreUnavailableException | SchemaException ex) {
            log.error("{} failed: {}", operation, ex.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    private void printStats() {
        StoreStats store = degradationController.guard("stats", maintenance::stats, StoreStats::unavailable);
        out.println("cache store: " + (store.available() ? store.path() : "unavailable"));
        if (store.available()) {
            out.println("  entries: " + store.cacheEntries());
            out.println("  feedback events: " + store.feedbackEvents());
            out.println("  size: " + store.sizeBytes() + " bytes");
        }
        ConfidenceStats confidence = degradationController.guard(
            "confidenceStats",
            confidenceService::confidenceStats,
            () -> null
        );
        if (confidence != null) {
            out.println("confidence:");
            out.println("  very high (>= 0.9): " + confidence.veryHigh());
            out.println("  high (0.8 - 0.9): " + confidence.high());
            out.println("  medium (0.5 - 0.8): " + confidence.medium());
            out.println("  low (< 0.5): " + confidence.low());
            out.println("  confirmations: " + confidence.totalConfirmations());
            out.println("  rejections: " + confidence.totalRejections());
            out.println(String.format(Locale.ROOT, "  average: %.3f", confidence.averageConfidence()));
        }
        CacheHealth health = degradationController.health();
        out.println("cache enabled: " + health.enabled());
        out.println("  errors: " + health.errorCount() + "/" + health.errorThreshold());
        if (health.lastError() != null) {
            out.println("  last error: " + health.lastError() + " at " + health.lastErrorAt());
        }
    }
}
