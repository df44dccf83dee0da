package com.elementcatalog;

/**
 * Root of every failure raised by the catalog core.
 *
 * The message carries the {@link Kind} as a "[KIND] " prefix so CLI output
 * and sync warnings name the failing stage. How each kind is handled:
 * <ul>
 *   <li>LOAD: the manifest and its backup are unusable, the type starts empty</li>
 *   <li>SCAN, SAVE, BACKUP: the element type fails for this sync, siblings continue</li>
 *   <li>VALIDATION: one entry is skipped while scanning, or a save is aborted</li>
 *   <li>SEARCH: malformed query input, reported to the caller</li>
 * </ul>
 */
public class CatalogException extends RuntimeException {

    public enum Kind { LOAD, SAVE, BACKUP, SCAN, SEARCH, VALIDATION }

    private final Kind kind;

    public CatalogException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public CatalogException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
