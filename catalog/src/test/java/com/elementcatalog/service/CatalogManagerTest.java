package com.elementcatalog.service;

import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CommandEntry;
import com.elementcatalog.model.ElementType;
import com.elementcatalog.model.Scope;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;
import com.elementcatalog.scan.ElementScanner;
import com.elementcatalog.scan.YamlFrontmatterParser;
import com.elementcatalog.search.ScoredEntry;
import com.elementcatalog.search.SearchException;
import com.elementcatalog.search.SearchQuery;
import com.elementcatalog.sync.CatalogCodec;
import com.elementcatalog.sync.CatalogSyncer;
import com.elementcatalog.sync.CatalogValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CatalogManager over real scope directories and manifests
 * under a temp dir. No Spring context; the clock is advanced by hand to
 * expire the cache.
 */
class CatalogManagerTest {

    private static final Duration TTL = Duration.ofSeconds(60);

    @TempDir Path tmp;

    Path globalRoot;
    Path projectRoot;
    Path localRoot;
    MutableClock clock;
    SimpleMeterRegistry meterRegistry;
    CatalogSyncer syncer;
    CatalogManager manager;

    @BeforeEach
    void setUp() throws IOException {
        globalRoot  = Files.createDirectories(tmp.resolve("home/.claude"));
        projectRoot = Files.createDirectories(tmp.resolve("repo/.claude"));
        localRoot   = Files.createDirectories(tmp.resolve("local/.claude"));
        Map<Scope, Path> roots = new EnumMap<>(Scope.class);
        roots.put(Scope.GLOBAL, globalRoot);
        roots.put(Scope.PROJECT, projectRoot);
        roots.put(Scope.LOCAL, localRoot);

        clock         = new MutableClock(Instant.parse("2026-04-01T08:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        syncer        = new CatalogSyncer(projectRoot.resolve(".manifest"),
                new CatalogCodec(), new CatalogValidator(), clock);
        ElementScanner scanner = new ElementScanner(scope -> Optional.ofNullable(roots.get(scope)),
                new YamlFrontmatterParser(), clock);
        manager = new CatalogManager(scanner, syncer, meterRegistry, clock, TTL, 50, 2);
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    // ------------------------------------------------------------------
    // syncCatalogs()
    // ------------------------------------------------------------------

    @Test
    void syncTwice_noFilesystemChange_keepsCountAndIds() throws IOException {
        skillFile(globalRoot, "code-analysis", "Analyse code");
        commandFile(projectRoot, "deploy", "Deploy the service");
        agentFile(localRoot, "reviewer", "Reviews diffs");

        SyncResult first = manager.syncCatalogs(Set.of(), true);
        Map<Path, UUID> firstIds = idsByPath();
        clock.advance(Duration.ofSeconds(5));
        SyncResult second = manager.syncCatalogs(Set.of(), true);

        assertThat(first.succeeded()).isTrue();
        assertThat(second.total()).isEqualTo(first.total()).isEqualTo(3);
        assertThat(idsByPath()).isEqualTo(firstIds);
        assertThat(second.reports().get(ElementType.SKILL).updated()).isEqualTo(1);
        assertThat(second.reports().get(ElementType.SKILL).added()).isZero();
    }

    @Test
    void sync_writesOneManifestPerType() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");

        manager.syncCatalogs(Set.of(ElementType.COMMAND), false);

        assertThat(syncer.manifestPath(ElementType.COMMAND)).exists();
        assertThat(syncer.manifestPath(ElementType.SKILL)).doesNotExist();
    }

    @Test
    void sync_removedFile_entryIsRetained() throws IOException {
        Path file = commandFile(globalRoot, "deploy", "Deploy");
        manager.syncCatalogs(Set.of(ElementType.COMMAND), true);

        Files.delete(file);
        SyncResult result = manager.syncCatalogs(Set.of(ElementType.COMMAND), true);

        assertThat(result.reports().get(ElementType.COMMAND).retained()).isEqualTo(1);
        assertThat(manager.listElements(TypeFilter.COMMAND, ScopeFilter.ALL, false))
                .extracting(CatalogEntry::name).containsExactly("/deploy");
    }

    @Test
    void sync_withinTtl_isServedFromCache() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");
        manager.syncCatalogs(Set.of(ElementType.COMMAND), false);

        SyncResult again = manager.syncCatalogs(Set.of(ElementType.COMMAND), false);

        assertThat(again.reports().get(ElementType.COMMAND).cached()).isTrue();
        assertThat(again.total()).isEqualTo(1);
    }

    @Test
    void sync_oneTypeFails_othersStillSaved() throws IOException {
        skillFile(globalRoot, "code-analysis", "Analyse code");
        agentFile(globalRoot, "reviewer", "Reviews diffs");
        // A non-empty directory where the commands manifest belongs cannot be replaced.
        Files.createDirectories(syncer.manifestPath(ElementType.COMMAND).resolve("blocker"));

        SyncResult result = manager.syncCatalogs(Set.of(), true);

        assertThat(result.failed()).containsExactly(ElementType.COMMAND);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).startsWith("commands:"));
        assertThat(result.reports()).containsOnlyKeys(ElementType.SKILL, ElementType.AGENT);
        assertThat(syncer.manifestPath(ElementType.SKILL)).isRegularFile();
        assertThat(syncer.manifestPath(ElementType.AGENT)).isRegularFile();

        assertThat(meterRegistry.get("catalog.sync.runs")
                .tag("type", "command").tag("status", "error").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("catalog.sync.runs")
                .tag("type", "skill").tag("status", "success").counter().count()).isEqualTo(1.0);
    }

    @Test
    void sync_recordsDurationAndSkippedFiles() throws IOException {
        Path dir = Files.createDirectories(globalRoot.resolve("skills/broken"));
        Files.writeString(dir.resolve("SKILL.md"), "no header");

        SyncResult result = manager.syncCatalogs(Set.of(ElementType.SKILL), true);

        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("broken"));
        assertThat(meterRegistry.get("catalog.scan.skipped").tag("type", "skill").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("catalog.sync.duration").tag("type", "skill").timer().count())
                .isEqualTo(1);
    }

    // ------------------------------------------------------------------
    // listElements() and the cache
    // ------------------------------------------------------------------

    @Test
    void listElements_autoSyncsAndFiltersByScope() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");
        commandFile(projectRoot, "test", "Run tests");

        List<CatalogEntry> project = manager.listElements(TypeFilter.COMMAND, ScopeFilter.PROJECT);

        assertThat(project).extracting(CatalogEntry::name).containsExactly("/test");
        // The manifest still holds every scope.
        assertThat(syncer.loadCatalog(ElementType.COMMAND).catalog().entries()).hasSize(2);
    }

    @Test
    void listElements_newFileAppearsOnlyAfterTtl() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");
        assertThat(manager.listElements(TypeFilter.COMMAND, ScopeFilter.ALL)).hasSize(1);

        commandFile(globalRoot, "rollback", "Roll back");
        clock.advance(Duration.ofSeconds(30));
        assertThat(manager.listElements(TypeFilter.COMMAND, ScopeFilter.ALL)).hasSize(1);

        clock.advance(Duration.ofSeconds(31));
        assertThat(manager.listElements(TypeFilter.COMMAND, ScopeFilter.ALL)).hasSize(2);
    }

    @Test
    void invalidate_forcesRescanOnNextRead() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");
        manager.listElements(TypeFilter.COMMAND, ScopeFilter.ALL);
        commandFile(globalRoot, "rollback", "Roll back");

        manager.invalidate();

        assertThat(manager.listElements(TypeFilter.COMMAND, ScopeFilter.ALL)).hasSize(2);
    }

    @Test
    void listElements_withoutAutoSync_readsManifestOnly() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");

        assertThat(manager.listElements(TypeFilter.ALL, ScopeFilter.ALL, false)).isEmpty();
        assertThat(syncer.manifestPath(ElementType.COMMAND)).doesNotExist();
    }

    // ------------------------------------------------------------------
    // searchElements() / getElement()
    // ------------------------------------------------------------------

    @Test
    void searchElements_nameMatchRanksAboveDescriptionMatch() throws IOException {
        skillFile(projectRoot, "code-analysis", "Static checks");
        commandFile(globalRoot, "deploy", "deploy and analysis tool");

        List<ScoredEntry> hits = manager.searchElements(SearchQuery.of("analysis"));

        assertThat(hits).extracting(h -> h.entry().name()).containsExactly("code-analysis", "/deploy");
    }

    @Test
    void getElement_prefersMostSpecificScope() throws IOException {
        agentFile(globalRoot, "reviewer", "Global reviewer");
        agentFile(projectRoot, "reviewer", "Project reviewer");
        agentFile(localRoot, "reviewer", "Local reviewer");

        assertThat(manager.getElement("Reviewer", TypeFilter.AGENT, false))
                .get().extracting(CatalogEntry::scope).isEqualTo(Scope.LOCAL);
        assertThat(manager.getElement("reviewer", TypeFilter.AGENT, ScopeFilter.GLOBAL, false))
                .get().extracting(CatalogEntry::description).isEqualTo("Global reviewer");
    }

    @Test
    void getElement_commandWithOrWithoutSlash() throws IOException {
        commandFile(globalRoot, "deploy", "Deploy");

        assertThat(manager.getElement("deploy", TypeFilter.ALL, false)).get().isInstanceOf(CommandEntry.class);
        assertThat(manager.getElement("/deploy", TypeFilter.COMMAND, false)).isPresent();
    }

    @Test
    void getElement_fuzzyFallsBackToBestHitAboveThreshold() throws IOException {
        skillFile(globalRoot, "code-analysis", "Static checks");

        assertThat(manager.getElement("analysis", TypeFilter.ALL, false)).isEmpty();
        assertThat(manager.getElement("analysis", TypeFilter.ALL, true))
                .get().extracting(CatalogEntry::name).isEqualTo("code-analysis");
        // description-only hit scores below the threshold
        assertThat(manager.getElement("static", TypeFilter.ALL, true)).isEmpty();
    }

    @Test
    void getElement_blankName_throwsSearchException() {
        assertThatThrownBy(() -> manager.getElement(" ", TypeFilter.ALL, true))
                .isInstanceOf(SearchException.class);
    }

    // ------------------------------------------------------------------
    // stats()
    // ------------------------------------------------------------------

    @Test
    void stats_countsPersistedEntriesByTypeAndScope() throws IOException {
        skillFile(globalRoot, "code-analysis", "Analyse");
        commandFile(projectRoot, "deploy", "Deploy");
        commandFile(localRoot, "lint", "Lint");
        manager.syncCatalogs(Set.of(), true);

        CatalogStats stats = manager.stats();

        assertThat(stats.total()).isEqualTo(3);
        assertThat(stats.byType()).containsEntry(ElementType.COMMAND, 2).containsEntry(ElementType.AGENT, 0);
        assertThat(stats.byScope()).containsEntry(Scope.GLOBAL, 1)
                .containsEntry(Scope.PROJECT, 1).containsEntry(Scope.LOCAL, 1);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Map<Path, UUID> idsByPath() {
        return manager.listElements(TypeFilter.ALL, ScopeFilter.ALL, false).stream()
                .collect(Collectors.toMap(CatalogEntry::path, CatalogEntry::id));
    }

    private static Path skillFile(Path root, String name, String description) throws IOException {
        Path dir = Files.createDirectories(root.resolve("skills").resolve(name));
        return Files.writeString(dir.resolve("SKILL.md"), header(name, description));
    }

    private static Path commandFile(Path root, String name, String description) throws IOException {
        Path dir = Files.createDirectories(root.resolve("commands"));
        return Files.writeString(dir.resolve(name + ".md"), header(name, description));
    }

    private static Path agentFile(Path root, String name, String description) throws IOException {
        Path dir = Files.createDirectories(root.resolve("agents"));
        return Files.writeString(dir.resolve(name + ".md"), header(name, description));
    }

    private static String header(String name, String description) {
        return "---\nname: " + name + "\ndescription: " + description + "\n---\n\nBody\n";
    }

    /** Clock the tests move forward by hand. */
    static final class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration step) {
            now = now.plus(step);
        }

        @Override public ZoneId getZone()                { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone)     { return this; }
        @Override public Instant instant()               { return now; }
    }
}
