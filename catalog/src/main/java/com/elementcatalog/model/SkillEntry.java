package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A skill: a directory under {@code <scope>/skills/} holding at least one
 * Markdown file with a metadata header.
 *
 * @param hasScripts   whether the skill ships a {@code scripts/} directory
 * @param fileCount    regular files directly inside the skill directory
 * @param allowedTools tools the skill may use, in header order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillEntry(
        UUID                id,
        String              name,
        String              description,
        Scope               scope,
        Path                path,
        Instant             createdAt,
        Instant             updatedAt,
        Map<String, Object> metadata,
        SkillTemplate       template,
        boolean             hasScripts,
        int                 fileCount,
        List<String>        allowedTools) implements CatalogEntry {

    public SkillEntry {
        id          = EntryChecks.id(id);
        name        = EntryChecks.plainName(name);
        description = EntryChecks.description(description);
        scope       = EntryChecks.scope(scope);
        path        = EntryChecks.path(path);
        EntryChecks.timestamps(createdAt, updatedAt);
        metadata    = EntryChecks.metadata(metadata);
        if (template == null) template = SkillTemplate.BASIC;
        if (fileCount < 0) {
            throw new CatalogValidationException("file_count must be >= 0, was " + fileCount);
        }
        allowedTools = EntryChecks.strings("allowed_tools", allowedTools);
    }

    @Override
    @JsonProperty("element_type")
    public ElementType elementType() { return ElementType.SKILL; }
}
