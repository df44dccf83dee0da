package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A slash command defined by {@code <scope>/commands/<name>.md}.
 * The name is stored with its leading '/'.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommandEntry(
        UUID                id,
        String              name,
        String              description,
        Scope               scope,
        Path                path,
        Instant             createdAt,
        Instant             updatedAt,
        Map<String, Object> metadata,
        List<String>        aliases,
        List<String>        requiresTools,
        List<String>        tags) implements CatalogEntry {

    public CommandEntry {
        id            = EntryChecks.id(id);
        name          = EntryChecks.commandName(name);
        description   = EntryChecks.description(description);
        scope         = EntryChecks.scope(scope);
        path          = EntryChecks.path(path);
        EntryChecks.timestamps(createdAt, updatedAt);
        metadata      = EntryChecks.metadata(metadata);
        aliases       = EntryChecks.strings("aliases", aliases);
        requiresTools = EntryChecks.strings("requires_tools", requiresTools);
        tags          = EntryChecks.strings("tags", tags);
    }

    @Override
    @JsonProperty("element_type")
    public ElementType elementType() { return ElementType.COMMAND; }
}
