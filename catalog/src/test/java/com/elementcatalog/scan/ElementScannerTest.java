package com.elementcatalog.scan;

import com.elementcatalog.model.AgentEntry;
import com.elementcatalog.model.AgentModel;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CommandEntry;
import com.elementcatalog.model.ElementType;
import com.elementcatalog.model.Scope;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.SkillEntry;
import com.elementcatalog.model.SkillTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Unit tests for ElementScanner against real directory trees under a temp dir.
 * No Spring context.
 */
class ElementScannerTest {

    @TempDir Path tmp;

    Path globalRoot;
    Path projectRoot;
    Map<Scope, Path> roots;
    ElementScanner scanner;

    @BeforeEach
    void setUp() throws IOException {
        globalRoot  = Files.createDirectories(tmp.resolve("home/.claude"));
        projectRoot = Files.createDirectories(tmp.resolve("repo/.claude"));
        roots = new EnumMap<>(Scope.class);
        roots.put(Scope.GLOBAL, globalRoot);
        roots.put(Scope.PROJECT, projectRoot);

        Clock clock = Clock.fixed(Instant.parse("2026-03-01T09:00:00Z"), ZoneOffset.UTC);
        scanner = new ElementScanner(scope -> Optional.ofNullable(roots.get(scope)),
                new YamlFrontmatterParser(), clock);
    }

    // ------------------------------------------------------------------
    // Skills
    // ------------------------------------------------------------------

    @Test
    void scanSkills_emptyScopeDirectory_returnsNothingWithoutWarnings() throws IOException {
        Files.createDirectories(globalRoot.resolve("skills"));

        ScanResult result = scanner.scanSkills(ScopeFilter.ALL);

        assertThat(result.entries()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scanSkills_validHeader_buildsSkillEntry() throws IOException {
        Path dir = Files.createDirectories(globalRoot.resolve("skills/code-analysis"));
        write(dir.resolve("SKILL.md"), """
                ---
                name: code-analysis
                description: Analyse a code base
                template: basic
                allowed-tools: Read, Grep
                tags: [quality]
                ---
                Body
                """);
        write(dir.resolve("notes.txt"), "extra");

        ScanResult result = scanner.scanSkills(ScopeFilter.ALL);

        assertThat(result.entries()).hasSize(1);
        SkillEntry skill = (SkillEntry) result.entries().get(0);
        assertThat(skill.name()).isEqualTo("code-analysis");
        assertThat(skill.template()).isEqualTo(SkillTemplate.BASIC);
        assertThat(skill.hasScripts()).isFalse();
        assertThat(skill.fileCount()).isEqualTo(2);
        assertThat(skill.allowedTools()).containsExactly("Read", "Grep");
        assertThat(skill.scope()).isEqualTo(Scope.GLOBAL);
        assertThat(skill.path()).isEqualTo(dir.toAbsolutePath().normalize());
        assertThat(skill.metadata()).containsKey("tags");
        assertThat(skill.createdAt()).isEqualTo(Instant.parse("2026-03-01T09:00:00Z"));
    }

    @Test
    void scanSkills_withoutSkillMd_usesFirstMarkdownAndDirName() throws IOException {
        Path dir = Files.createDirectories(projectRoot.resolve("skills/release"));
        Files.createDirectories(dir.resolve("scripts"));
        write(dir.resolve("scripts/run.sh"), "echo");
        write(dir.resolve("b.md"), "no header here");
        write(dir.resolve("a.md"), "---\ndescription: Cut a release\n---\n");

        ScanResult result = scanner.scanSkills(ScopeFilter.of(Scope.PROJECT));

        assertThat(result.entries()).singleElement().satisfies(e -> {
            SkillEntry skill = (SkillEntry) e;
            assertThat(skill.name()).isEqualTo("release");
            assertThat(skill.hasScripts()).isTrue();
            assertThat(skill.fileCount()).isEqualTo(2);
        });
    }

    @Test
    void scanSkills_badFilesAreSkippedWithWarnings() throws IOException {
        write(Files.createDirectories(globalRoot.resolve("skills/good")).resolve("SKILL.md"),
                "---\ndescription: fine\n---\n");
        write(Files.createDirectories(globalRoot.resolve("skills/no-header")).resolve("SKILL.md"),
                "# nothing\n");
        write(Files.createDirectories(globalRoot.resolve("skills/no-description")).resolve("SKILL.md"),
                "---\nname: nodesc\n---\n");

        ScanResult result = scanner.scanSkills(ScopeFilter.ALL);

        assertThat(result.entries()).extracting(CatalogEntry::name).containsExactly("good");
        assertThat(result.skipped()).isEqualTo(2);
        assertThat(result.warnings())
                .anySatisfy(w -> assertThat(w).contains("no-header").contains("no parseable metadata header"))
                .anySatisfy(w -> assertThat(w).contains("no-description").contains("invalid metadata"));
    }

    @Test
    void scanSkills_unreadableDirectory_isSkippedAndSiblingsStillScanned() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));

        write(Files.createDirectories(globalRoot.resolve("skills/alpha")).resolve("SKILL.md"),
                "---\ndescription: first\n---\n");
        Path locked = Files.createDirectories(globalRoot.resolve("skills/locked"));
        write(locked.resolve("SKILL.md"), "---\ndescription: hidden\n---\n");
        write(Files.createDirectories(globalRoot.resolve("skills/omega")).resolve("SKILL.md"),
                "---\ndescription: last\n---\n");

        Files.setPosixFilePermissions(locked, Set.of());
        try {
            assumeFalse(Files.isReadable(locked), "permissions are not enforced for this user");
            ScanResult result = scanner.scanSkills(ScopeFilter.ALL);

            assertThat(result.entries()).extracting(CatalogEntry::name).containsExactly("alpha", "omega");
            assertThat(result.skipped()).isEqualTo(1);
            assertThat(result.warnings()).singleElement().satisfies(w ->
                    assertThat(w).contains(locked.toString()).contains("directory cannot be read"));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void scanSkills_nameWithSlash_isSkippedWithWarning() throws IOException {
        write(Files.createDirectories(projectRoot.resolve("skills/good")).resolve("SKILL.md"),
                "---\ndescription: fine\n---\n");
        Path bad = write(Files.createDirectories(projectRoot.resolve("skills/nested")).resolve("SKILL.md"),
                "---\nname: a/b\ndescription: nested name\n---\n");

        ScanResult result = scanner.scanSkills(ScopeFilter.ALL);

        assertThat(result.entries()).extracting(CatalogEntry::name).containsExactly("good");
        assertThat(result.warnings()).singleElement().satisfies(w ->
                assertThat(w).contains(bad.toString()).contains("invalid metadata"));
    }

    // ------------------------------------------------------------------
    // Commands and agents
    // ------------------------------------------------------------------

    @Test
    void scanCommands_namesFromFileStemWithSlash() throws IOException {
        Path commands = Files.createDirectories(projectRoot.resolve("commands"));
        write(commands.resolve("deploy.md"), """
                ---
                description: Deploy the service
                aliases: [ship]
                requires-tools: Bash
                tags: ops, release
                ---
                """);
        write(commands.resolve("README.txt"), "ignored");

        ScanResult result = scanner.scanCommands(ScopeFilter.ALL);

        assertThat(result.entries()).singleElement().satisfies(e -> {
            CommandEntry cmd = (CommandEntry) e;
            assertThat(cmd.name()).isEqualTo("/deploy");
            assertThat(cmd.aliases()).containsExactly("ship");
            assertThat(cmd.requiresTools()).containsExactly("Bash");
            assertThat(cmd.tags()).containsExactly("ops", "release");
            assertThat(cmd.scope()).isEqualTo(Scope.PROJECT);
        });
    }

    @Test
    void scanAgents_defaultsModelAndAcceptsFullModelId() throws IOException {
        Path agents = Files.createDirectories(globalRoot.resolve("agents"));
        write(agents.resolve("reviewer.md"), "---\ndescription: Reviews diffs\n---\n");
        write(agents.resolve("planner.md"),
                "---\ndescription: Plans work\nmodel: claude-3-opus-20240229\nspecialization: planning\n---\n");

        ScanResult result = scanner.scan(ElementType.AGENT, ScopeFilter.ALL);

        assertThat(result.entries()).extracting(CatalogEntry::name).containsExactly("planner", "reviewer");
        AgentEntry planner  = (AgentEntry) result.entries().get(0);
        AgentEntry reviewer = (AgentEntry) result.entries().get(1);
        assertThat(planner.model()).isEqualTo(AgentModel.OPUS);
        assertThat(planner.specialization()).isEqualTo("planning");
        assertThat(reviewer.model()).isEqualTo(AgentModel.SONNET);
    }

    @Test
    void scanAgents_unknownModel_isSkippedWithWarning() throws IOException {
        Path agents = Files.createDirectories(globalRoot.resolve("agents"));
        write(agents.resolve("reviewer.md"), "---\ndescription: Reviews diffs\n---\n");
        Path bad = write(agents.resolve("oracle.md"), "---\ndescription: Sees all\nmodel: gpt-oracle\n---\n");

        ScanResult result = scanner.scanAgents(ScopeFilter.ALL);

        assertThat(result.entries()).extracting(CatalogEntry::name).containsExactly("reviewer");
        assertThat(result.skipped()).isEqualTo(1);
        assertThat(result.warnings()).singleElement().satisfies(w ->
                assertThat(w).contains(bad.toString()).contains("Unknown agent model"));
    }

    // ------------------------------------------------------------------
    // Scope roots
    // ------------------------------------------------------------------

    @Test
    void scan_missingRootOrTypeDir_isSilentlyEmpty() {
        roots.put(Scope.LOCAL, tmp.resolve("does-not-exist"));

        ScanResult result = scanner.scanAgents(ScopeFilter.ALL);

        assertThat(result.entries()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void scan_rootThatIsAFile_throwsScanException() throws IOException {
        Path file = write(tmp.resolve("not-a-dir"), "x");
        roots.put(Scope.LOCAL, file);

        assertThatThrownBy(() -> scanner.scanCommands(ScopeFilter.of(Scope.LOCAL)))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("local");
    }

    @Test
    void scan_filterRestrictsScopes() throws IOException {
        write(Files.createDirectories(globalRoot.resolve("commands")).resolve("a.md"), "---\ndescription: A\n---\n");
        write(Files.createDirectories(projectRoot.resolve("commands")).resolve("b.md"), "---\ndescription: B\n---\n");

        assertThat(scanner.scanCommands(ScopeFilter.of(Scope.GLOBAL)).entries())
                .extracting(CatalogEntry::name).containsExactly("/a");
    }

    private static Path write(Path file, String content) throws IOException {
        return Files.writeString(file, content);
    }
}
