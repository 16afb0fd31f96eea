package com.aicmd.cache.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.aicmd.cache.matching.MatchingProperties;
import com.aicmd.cache.matching.QueryMatcher;
import com.aicmd.cache.repository.CacheEntry;
import com.aicmd.cache.repository.CacheEntryRepository;
import com.aicmd.cache.store.CommandStore;
import com.aicmd.cache.support.MutableClock;
import com.aicmd.cache.support.TestStores;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CommandCacheManagerTest {
    private static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private final MutableClock clock = new MutableClock(START);
    private final CacheEntryRepository entries = new CacheEntryRepository();
    private CommandStore store;
    private CommandCacheManager manager;

    @BeforeEach
    void setUp() {
        store = TestStores.open(tempDir);
        manager = manager(store);
    }

    private CommandCacheManager manager(CommandStore commandStore) {
        MatchingProperties matching = new MatchingProperties();
        return new CommandCacheManager(
            commandStore,
            entries,
            new QueryMatcher(matching),
            matching,
            new CacheProperties(),
            clock
        );
    }

    @Test
    void savedCommandIsFoundByEquivalentQuery() {
        manager.save("list files", "  ls -la ", "linux", "bash");

        Optional<CacheEntry> found = manager.findExact("List   FILES");

        assertThat(found).isPresent();
        assertThat(found.get().getCommand()).isEqualTo("ls -la");
        assertThat(found.get().getConfirmationCount()).isZero();
        assertThat(found.get().getConfidenceScore()).isZero();
        assertThat(found.get().getOsType()).isEqualTo("linux");
        assertThat(found.get().getShellType()).isEqualTo("bash");
    }

    @Test
    void missingQueryHasNoExactMatch() {
        assertThat(manager.findExact("list files")).isEmpty();
    }

    @Test
    void savingSameCommandKeepsFeedbackHistory() {
        CacheEntry first = manager.save("list files", "ls -la", "linux", "bash");
        store.inTransaction("feedback", jdbc -> entries.updateFeedback(jdbc, first.getQueryHash(), 4, 1, 0.4, null));
        clock.advance(Duration.ofHours(1));

        CacheEntry merged = manager.save("list the files", "ls -la", "macos", "zsh");

        assertThat(merged.getId()).isEqualTo(first.getId());
        assertThat(merged.getConfirmationCount()).isEqualTo(4);
        assertThat(merged.getRejectionCount()).isEqualTo(1);
        assertThat(merged.getShellType()).isEqualTo("zsh");
        assertThat(merged.getLastUsedAt()).isEqualTo(START.plus(Duration.ofHours(1)));
        assertThat(manager.count()).isEqualTo(1);
    }

    @Test
    void savingDifferentCommandResetsFeedback() {
        CacheEntry first = manager.save("list files", "ls -la", "linux", "bash");
        store.inTransaction("feedback", jdbc -> entries.updateFeedback(jdbc, first.getQueryHash(), 4, 1, 0.4, null));

        CacheEntry replaced = manager.save("list files", "ls -lah", "linux", "bash");

        assertThat(replaced.getCommand()).isEqualTo("ls -lah");
        assertThat(replaced.getConfirmationCount()).isZero();
        assertThat(replaced.getRejectionCount()).isZero();
        assertThat(replaced.getConfidenceScore()).isZero();
        assertThat(manager.count()).isEqualTo(1);
    }

    @Test
    void blankInputIsRejected() {
        assertThatThrownBy(() -> manager.save(" ", "ls", "linux", "bash"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> manager.save("list files", "", "linux", "bash"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingPlatformIsDetected() {
        CacheEntry saved = manager.save("list files", "ls", null, null);

        assertThat(saved.getOsType()).isNotBlank();
        assertThat(saved.getShellType()).isNotBlank();
    }

    @Test
    void findSimilarHonoursThreshold() {
        manager.save("list all files", "ls -la", "linux", "bash");

        Optional<SimilarMatch> loose = manager.findSimilar("show all logs", 10, 0.6);
        assertThat(loose).isPresent();
        assertThat(loose.get().entry().getCommand()).isEqualTo("ls -la");
        assertThat(loose.get().similarity()).isBetween(0.6, 0.7);

        assertThat(manager.findSimilar("show all logs", 10, 0.95)).isEmpty();
    }

    @Test
    void findSimilarReturnsAnEntryWithTheSameNormalizedQuery() {
        manager.save("list all files", "ls -la", "linux", "bash");

        Optional<SimilarMatch> match = manager.findSimilar("show all files", 10, 0.6);

        assertThat(match).isPresent();
        assertThat(match.get().entry().getCommand()).isEqualTo("ls -la");
        assertThat(match.get().similarity()).isEqualTo(1.0);
    }

    @Test
    void findSimilarPrefersHighestSimilarity() {
        manager.save("list docker images", "docker images", "linux", "bash");
        manager.save("list all files", "ls -la", "linux", "bash");

        Optional<SimilarMatch> match = manager.findSimilar("list docker containers", 10, 0.5);

        assertThat(match).isPresent();
        assertThat(match.get().entry().getCommand()).isEqualTo("docker images");
    }

    @Test
    void findSimilarWithZeroLimitScansNothing() {
        manager.save("list all files", "ls -la", "linux", "bash");

        assertThat(manager.findSimilar("show all logs", 0, 0.1)).isEmpty();
    }

    @Test
    void cleanupEnforcesAgeAndSizeLimits() {
        List<String> words = List.of("alpha", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel");
        for (String word : words) {
            manager.save("run " + word, "echo " + word, "linux", "bash");
            clock.advance(Duration.ofDays(2));
        }
        Instant now = clock.instant();

        int removed = manager.cleanup(10, 3);

        assertThat(removed).isEqualTo(5);
        assertThat(manager.count()).isEqualTo(3);
        List<CacheEntry> remaining = store.withConnection("list", jdbc -> entries.listMostRecent(jdbc, 10));
        assertThat(remaining).allSatisfy(entry ->
            assertThat(entry.getLastUsedAt()).isAfterOrEqualTo(now.minus(Duration.ofDays(10))));
        assertThat(remaining).extracting(CacheEntry::getCommand)
            .containsExactly("echo hotel", "echo golf", "echo foxtrot");
    }

    @Test
    void cleanupRejectsNegativeLimits() {
        assertThatThrownBy(() -> manager.cleanup(-1, 10)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void touchDeleteAndClear() {
        CacheEntry saved = manager.save("list files", "ls", "linux", "bash");
        manager.save("show disk usage", "df -h", "linux", "bash");
        clock.advance(Duration.ofMinutes(5));

        assertThat(manager.touch(saved.getQueryHash())).isTrue();
        assertThat(manager.findExact("list files").orElseThrow().getLastUsedAt())
            .isEqualTo(START.plus(Duration.ofMinutes(5)));
        assertThat(manager.touch("missing")).isFalse();

        assertThat(manager.delete(saved.getQueryHash())).isTrue();
        assertThat(manager.delete(saved.getQueryHash())).isFalse();
        assertThat(manager.count()).isEqualTo(1);

        assertThat(manager.clear()).isEqualTo(1);
        assertThat(manager.count()).isZero();
    }

    @Test
    void unavailableStoreSurfacesAsCacheUnavailable() {
        CommandCacheManager disabled = manager(TestStores.disabled());

        assertThatThrownBy(() -> disabled.findExact("list files"))
            .isInstanceOf(CacheUnavailableException.class);
        assertThatThrownBy(() -> disabled.save("list files", "ls", "linux", "bash"))
            .isInstanceOf(CacheUnavailableException.class);
    }
}
