package com.elementcatalog.scan;

import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link MetadataHeaderParser} for Markdown files that open with a YAML
 * front-matter block:
 * <pre>
 * ---
 * name: code-analysis
 * description: Analyse a code base
 * ---
 * # body...
 * </pre>
 * Only the head of the file is read ({@link #MAX_HEADER_BYTES}); a header
 * that is not closed within it counts as unparseable.
 */
public class YamlFrontmatterParser implements MetadataHeaderParser {

    static final int MAX_HEADER_BYTES = 64 * 1024;

    private static final String DELIMITER = "---";

    @Override
    public Map<String, Object> parse(Path file) {
        String head;
        try (InputStream in = Files.newInputStream(file)) {
            head = new String(in.readNBytes(MAX_HEADER_BYTES), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UnparseableMetadataException("cannot read " + file + ": " + e.getMessage(), e);
        }
        return parseHeader(head);
    }

    /** Extracts and parses the front-matter block of {@code content}. */
    public Map<String, Object> parseHeader(String content) {
        String text = content.startsWith("\uFEFF") ? content.substring(1) : content;
        String[] lines = text.split("\r?\n", -1);
        if (lines.length == 0 || !lines[0].strip().equals(DELIMITER)) {
            throw new UnparseableMetadataException("no front-matter block");
        }

        StringBuilder yamlText = new StringBuilder();
        boolean closed = false;
        for (int i = 1; i < lines.length; i++) {
            String trimmed = lines[i].strip();
            if (trimmed.equals(DELIMITER) || trimmed.equals("...")) {
                closed = true;
                break;
            }
            yamlText.append(lines[i]).append('\n');
        }
        if (!closed) {
            throw new UnparseableMetadataException("front-matter block is not closed");
        }

        Object data;
        try {
            data = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlText.toString());
        } catch (YAMLException e) {
            throw new UnparseableMetadataException("invalid YAML: " + e.getMessage(), e);
        }
        if (!(data instanceof Map<?, ?> map) || map.isEmpty()) {
            throw new UnparseableMetadataException("front-matter is not a key/value mapping");
        }

        Map<String, Object> header = new LinkedHashMap<>();
        map.forEach((k, v) -> header.put(String.valueOf(k), v));
        return header;
    }
}
