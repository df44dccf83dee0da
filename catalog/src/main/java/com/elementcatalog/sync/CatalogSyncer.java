package com.elementcatalog.sync;

import com.elementcatalog.model.Catalog;
import com.elementcatalog.model.CatalogEntries;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.CatalogValidationException;
import com.elementcatalog.model.ElementType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads, saves and merges the per-type manifests kept in one manifest directory
 * ({@code <dir>/skills.json}, {@code commands.json}, {@code agents.json}).
 *
 * <p>Save protocol, so that no reader ever sees a half-written manifest:
 * <ol>
 *   <li>copy the current manifest to {@code <file>.backup}</li>
 *   <li>write the new catalog to {@code <file>.tmp} and force it to disk</li>
 *   <li>read the tmp file back and validate it</li>
 *   <li>move tmp over the manifest</li>
 *   <li>delete the backup</li>
 * </ol>
 * A failure in steps 2-4 leaves the manifest untouched and the backup in place.
 *
 * <p>Concurrent writers in different processes are not coordinated; the
 * last rename wins.
 */
public class CatalogSyncer {

    private static final Logger log = LoggerFactory.getLogger(CatalogSyncer.class);

    static final String MANIFEST_SUFFIX = ".json";
    static final String BACKUP_SUFFIX   = ".backup";
    static final String TMP_SUFFIX      = ".tmp";

    private final Path             manifestDir;
    private final CatalogCodec     codec;
    private final CatalogValidator validator;
    private final Clock            clock;

    public CatalogSyncer(Path manifestDir, CatalogCodec codec, CatalogValidator validator, Clock clock) {
        this.manifestDir = Objects.requireNonNull(manifestDir, "manifestDir").toAbsolutePath().normalize();
        this.codec       = codec;
        this.validator   = validator;
        this.clock       = clock;
    }

    public Path manifestDir() { return manifestDir; }

    public Path manifestPath(ElementType type) {
        return manifestDir.resolve(type.plural() + MANIFEST_SUFFIX);
    }

    public Path backupPath(ElementType type) {
        return sibling(manifestPath(type), BACKUP_SUFFIX);
    }

    Path tmpPath(ElementType type) {
        return sibling(manifestPath(type), TMP_SUFFIX);
    }

    // ------------------------------------------------------------------
    // Load
    // ------------------------------------------------------------------

    /**
     * Load the persisted catalog of {@code type}. Never throws: an unusable
     * manifest falls back to its backup, and when that is unusable too an
     * empty catalog is returned with the failure as a warning.
     */
    public LoadResult loadCatalog(ElementType type) {
        Path primary = manifestPath(type);
        Path backup  = backupPath(type);
        List<String> warnings = new ArrayList<>();
        Exception failure = null;

        if (Files.exists(primary)) {
            try {
                return new LoadResult(read(primary, type), LoadResult.Source.PRIMARY, warnings);
            } catch (IOException | CatalogValidationException e) {
                failure = e;
                String msg = "Manifest " + primary + " is unreadable or invalid: " + e.getMessage();
                log.warn(msg);
                warnings.add(msg);
            }
        } else if (!Files.exists(backup)) {
            log.debug("No {} manifest at {}, starting empty", type.plural(), primary);
            return new LoadResult(Catalog.empty(type), LoadResult.Source.EMPTY, warnings);
        }

        if (Files.exists(backup)) {
            try {
                Catalog recovered = read(backup, type);
                String msg = "Recovered " + type.plural() + " catalog from backup " + backup;
                log.warn(msg);
                warnings.add(msg);
                return new LoadResult(recovered, LoadResult.Source.BACKUP, warnings);
            } catch (IOException | CatalogValidationException e) {
                failure = e;
                String msg = "Backup " + backup + " is unreadable or invalid: " + e.getMessage();
                log.warn(msg);
                warnings.add(msg);
            }
        }

        CatalogLoadException degraded = new CatalogLoadException(type,
                "No usable " + type.plural() + " manifest, continuing with an empty catalog", failure);
        log.warn(degraded.getMessage());
        warnings.add(degraded.getMessage());
        return new LoadResult(Catalog.empty(type), LoadResult.Source.EMPTY, warnings);
    }

    private Catalog read(Path file, ElementType type) throws IOException {
        Catalog catalog = codec.decode(Files.readAllBytes(file), type);
        validator.validate(catalog);
        return catalog;
    }

    // ------------------------------------------------------------------
    // Save
    // ------------------------------------------------------------------

    /**
     * Persist {@code catalog} with the backup / tmp / validate / rename protocol.
     *
     * @throws CatalogBackupException if the current manifest cannot be backed up;
     *                                nothing has been written
     * @throws CatalogSaveException   if writing, verifying or renaming fails; the
     *                                manifest is unchanged
     */
    public void saveCatalog(Catalog catalog) {
        ElementType type = catalog.elementType();
        Path target = manifestPath(type);
        Path tmp    = tmpPath(type);

        try {
            Files.createDirectories(manifestDir);
        } catch (IOException e) {
            throw new CatalogSaveException("Cannot create manifest directory " + manifestDir, e);
        }

        Path backup = Files.exists(target) ? backupCatalog(type) : null;

        try {
            writeDurably(tmp, codec.encode(catalog));

            Catalog readBack = read(tmp, type);
            if (readBack.size() != catalog.size()) {
                throw new CatalogValidationException("Read-back of " + tmp + " has "
                        + readBack.size() + " entries, expected " + catalog.size());
            }

            moveIntoPlace(tmp, target);
        } catch (IOException | CatalogValidationException e) {
            discardTmp(tmp);
            log.error("Saving {} catalog failed, {} left unchanged{}", type.plural(), target,
                    backup != null ? " (backup kept at " + backup + ")" : "", e);
            throw new CatalogSaveException("Failed to save " + type.plural() + " catalog to " + target, e);
        }

        if (backup != null) {
            try {
                Files.deleteIfExists(backup);
            } catch (IOException e) {
                log.warn("Saved {} but could not remove backup {}: {}", target, backup, e.getMessage());
            }
        }
        log.info("Saved {} catalog: {} entries -> {}", type.plural(), catalog.size(), target);
    }

    /**
     * Copy the current manifest of {@code type} to its {@code .backup} sibling.
     *
     * @return the backup path
     * @throws CatalogBackupException if there is no manifest or the copy fails
     */
    public Path backupCatalog(ElementType type) {
        Path target = manifestPath(type);
        Path backup = backupPath(type);
        if (!Files.exists(target)) {
            throw new CatalogBackupException("No " + type.plural() + " manifest to back up at " + target);
        }
        try {
            Files.copy(target, backup, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        } catch (IOException e) {
            throw new CatalogBackupException("Cannot back up " + target + " to " + backup, e);
        }
        log.debug("Backed up {} -> {}", target, backup);
        return backup;
    }

    private static void writeDurably(Path file, byte[] bytes) throws IOException {
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            // Replace is not atomic here: a crash between delete and rename leaves only the backup.
            log.warn("Atomic move not supported for {}, falling back to plain replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void discardTmp(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temporary manifest {}: {}", tmp, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Merge
    // ------------------------------------------------------------------

    /**
     * Reconcile freshly scanned entries with the persisted ones, keyed on
     * {@code (scope, path)}.
     *
     * <ul>
     *   <li>in both: persisted id and created_at, scanned content, updated_at = now</li>
     *   <li>scanned only: added unchanged</li>
     *   <li>persisted only: kept unchanged, even when its path is gone</li>
     * </ul>
     * Duplicate names within one scope are reported, not resolved.
     */
    public MergeResult mergeEntries(List<? extends CatalogEntry> existing,
                                    List<? extends CatalogEntry> discovered) {
        Instant now = clock.instant();

        Map<CatalogEntries.Key, CatalogEntry> pending = new LinkedHashMap<>();
        for (CatalogEntry d : discovered) {
            pending.putIfAbsent(CatalogEntries.Key.of(d), d);
        }

        List<CatalogEntry> merged = new ArrayList<>(existing.size() + pending.size());
        int updated  = 0;
        int retained = 0;
        for (CatalogEntry e : existing) {
            CatalogEntry fresh = pending.remove(CatalogEntries.Key.of(e));
            if (fresh == null) {
                merged.add(e);
                retained++;
            } else {
                Instant touched = now.isBefore(e.createdAt()) ? e.createdAt() : now;
                merged.add(CatalogEntries.withIdentity(fresh, e.id(), e.createdAt(), touched));
                updated++;
            }
        }
        merged.addAll(pending.values());

        Map<String, Integer> conflicts = CatalogEntries.nameConflicts(merged);
        if (!conflicts.isEmpty()) {
            log.warn("Duplicate names within a scope after merge: {}", conflicts);
        }
        return new MergeResult(merged, pending.size(), updated, retained, conflicts);
    }

    private static Path sibling(Path file, String suffix) {
        return file.resolveSibling(file.getFileName() + suffix);
    }
}
