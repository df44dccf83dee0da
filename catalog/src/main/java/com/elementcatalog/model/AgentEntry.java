package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * A sub-agent defined by {@code <scope>/agents/<name>.md}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AgentEntry(
        UUID                id,
        String              name,
        String              description,
        Scope               scope,
        Path                path,
        Instant             createdAt,
        Instant             updatedAt,
        Map<String, Object> metadata,
        AgentModel          model,
        String              specialization,
        List<String>        requiresSkills,
        List<String>        tags) implements CatalogEntry {

    public static final String DEFAULT_SPECIALIZATION = "general";

    public AgentEntry {
        id             = EntryChecks.id(id);
        name           = EntryChecks.plainName(name);
        description    = EntryChecks.description(description);
        scope          = EntryChecks.scope(scope);
        path           = EntryChecks.path(path);
        EntryChecks.timestamps(createdAt, updatedAt);
        metadata       = EntryChecks.metadata(metadata);
        if (model == null) throw new CatalogValidationException("Agent model is required");
        specialization = (specialization == null || specialization.isBlank())
                ? DEFAULT_SPECIALIZATION : specialization.strip();
        requiresSkills = EntryChecks.strings("requires_skills", requiresSkills);
        tags           = EntryChecks.strings("tags", tags);
    }

    @Override
    @JsonProperty("element_type")
    public ElementType elementType() { return ElementType.AGENT; }
}
