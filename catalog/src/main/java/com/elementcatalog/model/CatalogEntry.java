package com.elementcatalog.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * One discovered element. The set of variants is closed and tagged by
 * {@link #elementType()}; code that needs a variant-specific attribute
 * switches on the tag (see {@link CatalogEntries}).
 *
 * <p>Identity across rescans is {@code (scope, path)}, not {@code id}:
 * the scanner mints a fresh id every pass and the merge step restores the
 * persisted one.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME,
              include = JsonTypeInfo.As.EXISTING_PROPERTY,
              property = "element_type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SkillEntry.class,   name = "skill"),
        @JsonSubTypes.Type(value = CommandEntry.class, name = "command"),
        @JsonSubTypes.Type(value = AgentEntry.class,   name = "agent")
})
public sealed interface CatalogEntry permits SkillEntry, CommandEntry, AgentEntry {

    UUID id();

    String name();

    String description();

    Scope scope();

    /** Absolute path of the defining file (commands, agents) or directory (skills). */
    Path path();

    Instant createdAt();

    Instant updatedAt();

    ElementType elementType();

    /** Header keys that no typed field consumed. */
    Map<String, Object> metadata();
}
