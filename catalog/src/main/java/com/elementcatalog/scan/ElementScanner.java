package com.elementcatalog.scan;

import com.elementcatalog.model.AgentEntry;
import com.elementcatalog.model.AgentModel;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CatalogValidationException;
import com.elementcatalog.model.CommandEntry;
import com.elementcatalog.model.ElementType;
import com.elementcatalog.model.Scope;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.SkillEntry;
import com.elementcatalog.model.SkillTemplate;
import com.elementcatalog.scope.ScopeRootResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Discovers elements below the scope roots.
 *
 * <pre>
 *   skills:   {root}/skills/{name}/*.md     (SKILL.md preferred)
 *   commands: {root}/commands/{name}.md
 *   agents:   {root}/agents/{name}.md
 * </pre>
 *
 * A scan is a pure read. One bad file never aborts it: files without a
 * parseable header, headers that fail validation and unreadable directories
 * are skipped and reported as warnings. Only a scope root that exists but
 * cannot be listed raises {@link ScanException}.
 *
 * <p>Every entry gets a new id; the sync step maps it back onto the persisted
 * entry with the same {@code (scope, path)}.
 */
@Component
public class ElementScanner {

    private static final Logger log = LoggerFactory.getLogger(ElementScanner.class);

    static final String SKILL_FILE  = "SKILL.md";
    static final String SCRIPTS_DIR = "scripts";
    static final String MARKDOWN    = ".md";

    private static final Set<String> SKILL_KEYS = Set.of(
            "name", "description", "template", "allowed-tools", "allowed_tools", "allowedTools");
    private static final Set<String> COMMAND_KEYS = Set.of(
            "name", "description", "aliases", "requires_tools", "requires-tools", "tags");
    private static final Set<String> AGENT_KEYS = Set.of(
            "name", "description", "model", "specialization",
            "requires_skills", "requires-skills", "tags");

    private final ScopeRootResolver    scopes;
    private final MetadataHeaderParser headers;
    private final Clock                clock;

    public ElementScanner(ScopeRootResolver scopes, MetadataHeaderParser headers, Clock clock) {
        this.scopes  = scopes;
        this.headers = headers;
        this.clock   = clock;
    }

    // ------------------------------------------------------------------
    // Entry points
    // ------------------------------------------------------------------

    /**
     * Scan one element type in every scope selected by {@code filter}.
     *
     * @throws ScanException if a resolved scope root exists but is not a readable directory
     */
    public ScanResult scan(ElementType type, ScopeFilter filter) {
        Collector out = new Collector(type);
        for (Scope scope : filter.scopes()) {
            Optional<Path> root = scopes.resolve(scope);
            if (root.isEmpty() || !usableRoot(root.get(), scope)) {
                continue;
            }
            Path typeDir = root.get().resolve(type.plural());
            if (!Files.exists(typeDir)) {
                continue;
            }
            if (!Files.isDirectory(typeDir)) {
                out.skip(typeDir, "not a directory");
                continue;
            }
            List<Path> children;
            try {
                children = listSorted(typeDir);
            } catch (IOException e) {
                out.skip(typeDir, "directory cannot be read (" + e.getMessage() + ")");
                continue;
            }
            switch (type) {
                case SKILL   -> scanSkillDirs(scope, children, out);
                case COMMAND -> scanFiles(scope, children, out, (file, header) -> toCommand(scope, file, header));
                case AGENT   -> scanFiles(scope, children, out, (file, header) -> toAgent(scope, file, header));
            }
        }
        ScanResult result = out.result();
        log.debug("Scanned {} ({}): {} found, {} skipped",
                type.plural(), filter, result.entries().size(), result.skipped());
        return result;
    }

    public ScanResult scanSkills(ScopeFilter filter)   { return scan(ElementType.SKILL, filter); }

    public ScanResult scanCommands(ScopeFilter filter) { return scan(ElementType.COMMAND, filter); }

    public ScanResult scanAgents(ScopeFilter filter)   { return scan(ElementType.AGENT, filter); }

    // ------------------------------------------------------------------
    // Walking
    // ------------------------------------------------------------------

    private boolean usableRoot(Path root, Scope scope) {
        if (!Files.exists(root)) {
            log.debug("Scope {} root {} does not exist, skipping", scope.key(), root);
            return false;
        }
        if (!Files.isDirectory(root) || !Files.isReadable(root)) {
            throw new ScanException("Scope " + scope.key() + " root is not a readable directory: " + root);
        }
        return true;
    }

    private void scanSkillDirs(Scope scope, List<Path> children, Collector out) {
        for (Path dir : children) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            List<Path> markdown;
            try {
                markdown = listSorted(dir).stream()
                        .filter(ElementScanner::isMarkdownFile)
                        .toList();
            } catch (IOException e) {
                out.skip(dir, "directory cannot be read (" + e.getMessage() + ")");
                continue;
            }
            if (markdown.isEmpty()) {
                log.debug("No Markdown file in skill directory {}, ignoring", dir);
                continue;
            }
            Path headerFile = markdown.stream()
                    .filter(p -> p.getFileName().toString().equals(SKILL_FILE))
                    .findFirst()
                    .orElse(markdown.get(0));
            collect(dir, headerFile, out, header -> toSkill(scope, dir, header));
        }
    }

    private void scanFiles(Scope scope, List<Path> children, Collector out, FileEntryBuilder builder) {
        for (Path file : children) {
            if (isMarkdownFile(file)) {
                collect(file, file, out, header -> builder.build(file, header));
            }
        }
    }

    private void collect(Path element, Path headerFile, Collector out, EntryBuilder builder) {
        try {
            CatalogEntry entry = builder.build(headers.parse(headerFile));
            out.entries.add(entry);
            log.debug("Discovered {} '{}' at {}", entry.elementType().key(), entry.name(), element);
        } catch (UnparseableMetadataException e) {
            out.skip(headerFile, "no parseable metadata header (" + e.getMessage() + ")");
        } catch (CatalogValidationException e) {
            out.skip(headerFile, "invalid metadata: " + e.getMessage());
        } catch (IOException e) {
            out.skip(element, "cannot be read (" + e.getMessage() + ")");
        }
    }

    // ------------------------------------------------------------------
    // Entry construction
    // ------------------------------------------------------------------

    private SkillEntry toSkill(Scope scope, Path dir, Map<String, Object> header) throws IOException {
        Instant now = clock.instant();
        return new SkillEntry(
                UUID.randomUUID(),
                HeaderValues.string(header, "name").orElse(dir.getFileName().toString()),
                HeaderValues.string(header, "description").orElse(null),
                scope,
                dir.toAbsolutePath().normalize(),
                now, now,
                HeaderValues.remaining(header, SKILL_KEYS),
                HeaderValues.string(header, "template").map(SkillTemplate::fromKey).orElse(SkillTemplate.BASIC),
                Files.isDirectory(dir.resolve(SCRIPTS_DIR)),
                countFiles(dir),
                HeaderValues.strings(header, "allowed-tools", "allowed_tools", "allowedTools"));
    }

    private CommandEntry toCommand(Scope scope, Path file, Map<String, Object> header) {
        Instant now = clock.instant();
        return new CommandEntry(
                UUID.randomUUID(),
                HeaderValues.string(header, "name").orElse(stem(file)),
                HeaderValues.string(header, "description").orElse(null),
                scope,
                file.toAbsolutePath().normalize(),
                now, now,
                HeaderValues.remaining(header, COMMAND_KEYS),
                HeaderValues.strings(header, "aliases"),
                HeaderValues.strings(header, "requires_tools", "requires-tools"),
                HeaderValues.strings(header, "tags"));
    }

    private AgentEntry toAgent(Scope scope, Path file, Map<String, Object> header) {
        Instant now = clock.instant();
        return new AgentEntry(
                UUID.randomUUID(),
                HeaderValues.string(header, "name").orElse(stem(file)),
                HeaderValues.string(header, "description").orElse(null),
                scope,
                file.toAbsolutePath().normalize(),
                now, now,
                HeaderValues.remaining(header, AGENT_KEYS),
                HeaderValues.string(header, "model").map(AgentModel::fromKey).orElse(AgentModel.SONNET),
                HeaderValues.string(header, "specialization").orElse(null),
                HeaderValues.strings(header, "requires_skills", "requires-skills"),
                HeaderValues.strings(header, "tags"));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static List<Path> listSorted(Path dir) throws IOException {
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            stream.forEach(children::add);
        }
        children.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return children;
    }

    private static boolean isMarkdownFile(Path p) {
        return Files.isRegularFile(p)
                && p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(MARKDOWN);
    }

    /** Regular files directly inside {@code dir}; sub-directories are not descended into. */
    private static int countFiles(Path dir) throws IOException {
        return (int) listSorted(dir).stream().filter(Files::isRegularFile).count();
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - MARKDOWN.length());
    }

    @FunctionalInterface
    private interface EntryBuilder {
        CatalogEntry build(Map<String, Object> header) throws IOException;
    }

    @FunctionalInterface
    private interface FileEntryBuilder {
        CatalogEntry build(Path file, Map<String, Object> header);
    }

    /** Mutable accumulator for one scan. */
    private static final class Collector {
        private final ElementType        type;
        private final List<CatalogEntry> entries  = new ArrayList<>();
        private final List<String>       warnings = new ArrayList<>();

        Collector(ElementType type) {
            this.type = type;
        }

        void skip(Path path, String reason) {
            log.warn("Skipping {} {}: {}", type.key(), path, reason);
            warnings.add(path + ": " + reason);
        }

        ScanResult result() {
            return new ScanResult(type, entries, warnings);
        }
    }
}
