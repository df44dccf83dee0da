package com.elementcatalog.sync;

import com.elementcatalog.model.Catalog;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CatalogValidationException;
import com.elementcatalog.model.ElementType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.deser.std.FromStringDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a manifest:
 * <pre>
 * {
 *   "schema_version": "1.0",
 *   "last_synced": "2026-01-01T10:00:00Z",
 *   "skills": [ { "id": "...", "element_type": "skill", "path": "/abs/path", ... } ]
 * }
 * </pre>
 * The entry list is keyed by the plural type name. Paths are plain strings,
 * timestamps ISO-8601, ids UUID strings, field names snake_case.
 */
public class CatalogCodec {

    static final String SCHEMA_VERSION = "schema_version";
    static final String LAST_SYNCED    = "last_synced";

    private static final TypeReference<List<CatalogEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public CatalogCodec() {
        SimpleModule paths = new SimpleModule("catalog-paths");
        paths.addSerializer(Path.class, new ToStringSerializer(Path.class));
        paths.addDeserializer(Path.class, new FromStringDeserializer<Path>(Path.class) {
            @Override
            protected Path _deserialize(String value, DeserializationContext ctxt) {
                return Path.of(value);
            }
        });

        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(paths)
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public byte[] encode(Catalog catalog) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put(SCHEMA_VERSION, catalog.schemaVersion());
        root.put(LAST_SYNCED, catalog.lastSynced().toString());
        ArrayNode list = root.putArray(catalog.elementType().plural());
        for (CatalogEntry entry : catalog.entries()) {
            JsonNode node = mapper.valueToTree(entry);
            list.add(node);
        }
        return mapper.writeValueAsBytes(root);
    }

    /**
     * @throws IOException                if the bytes are not JSON or an entry cannot be mapped
     *                                    (including entries whose fields break their constraints)
     * @throws CatalogValidationException if the document does not have the manifest shape
     */
    public Catalog decode(byte[] json, ElementType type) throws IOException {
        JsonNode root = mapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new CatalogValidationException("Manifest root is not a JSON object");
        }

        String version = requiredText(root, SCHEMA_VERSION);
        Instant lastSynced;
        try {
            lastSynced = Instant.parse(requiredText(root, LAST_SYNCED));
        } catch (DateTimeParseException e) {
            throw new CatalogValidationException("Invalid " + LAST_SYNCED + ": " + e.getParsedString(), e);
        }

        JsonNode list = root.get(type.plural());
        if (list == null || !list.isArray()) {
            throw new CatalogValidationException("Manifest has no '" + type.plural() + "' array");
        }
        List<CatalogEntry> entries = new ArrayList<>(list.size());
        for (JsonNode node : list) {
            if (!node.isObject()) {
                throw new CatalogValidationException("Manifest entry is not a JSON object: " + node);
            }
            entries.add(mapper.treeToValue(node, CatalogEntry.class));
        }
        return new Catalog(version, lastSynced, type, entries);
    }

    /** Entries in their persisted JSON form, for machine-readable output. */
    public String writeEntries(List<? extends CatalogEntry> entries) throws JsonProcessingException {
        return mapper.writerFor(ENTRY_LIST).writeValueAsString(entries);
    }

    public String writeValue(Object value) throws JsonProcessingException {
        return mapper.writeValueAsString(value);
    }

    private static String requiredText(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            throw new CatalogValidationException("Manifest field '" + field + "' is missing");
        }
        return node.asText();
    }
}
