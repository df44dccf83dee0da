package com.elementcatalog.scan;

import java.nio.file.Path;
import java.util.Map;

/**
 * Reads the key/value header at the start of an element file.
 */
@FunctionalInterface
public interface MetadataHeaderParser {

    /**
     * @return the header keys in file order, never empty
     * @throws UnparseableMetadataException if the file has no usable header,
     *         including when it cannot be read
     */
    Map<String, Object> parse(Path file) throws UnparseableMetadataException;
}
