package com.elementcatalog.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Helpers that specialize on the entry variant by switching on its tag.
 */
public final class CatalogEntries {

    private CatalogEntries() {}

    /** Natural key used to recognise the same element across scans. */
    public record Key(Scope scope, Path path) {
        public static Key of(CatalogEntry entry) {
            return new Key(entry.scope(), entry.path().toAbsolutePath().normalize());
        }
    }

    /**
     * Copy of {@code entry} carrying the given identity and timestamps; every
     * other field is kept.
     */
    public static CatalogEntry withIdentity(CatalogEntry entry, UUID id,
                                            Instant createdAt, Instant updatedAt) {
        return switch (entry.elementType()) {
            case SKILL -> {
                SkillEntry s = (SkillEntry) entry;
                yield new SkillEntry(id, s.name(), s.description(), s.scope(), s.path(),
                        createdAt, updatedAt, s.metadata(),
                        s.template(), s.hasScripts(), s.fileCount(), s.allowedTools());
            }
            case COMMAND -> {
                CommandEntry c = (CommandEntry) entry;
                yield new CommandEntry(id, c.name(), c.description(), c.scope(), c.path(),
                        createdAt, updatedAt, c.metadata(),
                        c.aliases(), c.requiresTools(), c.tags());
            }
            case AGENT -> {
                AgentEntry a = (AgentEntry) entry;
                yield new AgentEntry(id, a.name(), a.description(), a.scope(), a.path(),
                        createdAt, updatedAt, a.metadata(),
                        a.model(), a.specialization(), a.requiresSkills(), a.tags());
            }
        };
    }

    /**
     * Tags of an entry. Skills have no typed tag list; a {@code tags} header
     * key ends up in their metadata and is honoured from there.
     */
    public static List<String> tags(CatalogEntry entry) {
        return switch (entry.elementType()) {
            case COMMAND -> ((CommandEntry) entry).tags();
            case AGENT   -> ((AgentEntry) entry).tags();
            case SKILL   -> metadataStrings(entry.metadata().get("tags"));
        };
    }

    /**
     * Name used for matching: lower-cased, without the leading '/' that
     * command names carry.
     */
    public static String matchName(String name) {
        String n = name.strip().toLowerCase(Locale.ROOT);
        return n.startsWith("/") ? n.substring(1) : n;
    }

    /**
     * Names that occur more than once within the same scope, as
     * "scope:name" keys mapped to the number of occurrences.
     */
    public static Map<String, Integer> nameConflicts(List<? extends CatalogEntry> entries) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (CatalogEntry e : entries) {
            counts.merge(e.scope().key() + ":" + e.name().toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        counts.values().removeIf(c -> c < 2);
        return counts;
    }

    private static List<String> metadataStrings(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object o : list) {
                if (o != null) out.add(o.toString());
            }
        } else if (value instanceof String s) {
            for (String part : s.split(",")) {
                if (!part.isBlank()) out.add(part.strip());
            }
        }
        return out;
    }
}
