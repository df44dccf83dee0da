package com.elementcatalog.service;

import com.elementcatalog.model.CatalogEntries;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.ElementType;
import com.elementcatalog.model.Scope;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;
import com.elementcatalog.scan.ElementScanner;
import com.elementcatalog.scan.ScanException;
import com.elementcatalog.scan.ScanResult;
import com.elementcatalog.search.CatalogSearch;
import com.elementcatalog.search.ScoredEntry;
import com.elementcatalog.search.SearchException;
import com.elementcatalog.search.SearchQuery;
import com.elementcatalog.sync.CatalogSyncer;
import com.elementcatalog.sync.LoadResult;
import com.elementcatalog.sync.MergeResult;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the catalog: list, search, show and sync.
 *
 * Every read that auto-syncs runs, per element type,
 * {@code load -> scan (all scopes) -> merge -> save} and then filters. The
 * scan always covers every scope so the saved manifest stays complete even
 * when the caller only asked for one scope.
 *
 * <p>Results are memoized per element type for {@code cacheTtl}, so a burst
 * of calls does one sync. The cache belongs to this instance only.
 *
 * <p>Per-type failures never spread: a type that cannot be scanned or saved is
 * reported in {@link SyncResult#warnings()} and its last persisted entries are
 * served instead.
 */
@Service
public class CatalogManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CatalogManager.class);

    static final String MDC_ELEMENT_TYPE = "elementType";

    private final ElementScanner  scanner;
    private final CatalogSyncer   syncer;
    private final MeterRegistry   meterRegistry;
    private final Clock           clock;
    private final Duration        cacheTtl;
    private final int             fuzzyMinScore;
    private final ExecutorService scanPool;

    private final Map<ElementType, CachedCatalog> cache = new ConcurrentHashMap<>();

    private record CachedCatalog(List<CatalogEntry> entries, Instant syncedAt) {}

    private record SyncOutcome(SyncResult result, Map<ElementType, List<CatalogEntry>> entries) {}

    public CatalogManager(ElementScanner scanner,
                          CatalogSyncer syncer,
                          MeterRegistry meterRegistry,
                          Clock clock,
                          @Value("${catalog.cache-ttl:60s}") Duration cacheTtl,
                          @Value("${catalog.fuzzy-min-score:50}") int fuzzyMinScore,
                          @Value("${catalog.scan-workers:3}") int scanWorkers) {
        this.scanner       = scanner;
        this.syncer        = syncer;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.cacheTtl      = cacheTtl;
        this.fuzzyMinScore = fuzzyMinScore;

        AtomicInteger threadCount = new AtomicInteger();
        this.scanPool = Executors.newFixedThreadPool(Math.max(1, scanWorkers), r -> {
            Thread t = new Thread(r, "catalog-scan-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    // ------------------------------------------------------------------
    // List / search / show
    // ------------------------------------------------------------------

    public List<CatalogEntry> listElements(TypeFilter types, ScopeFilter scope) {
        return listElements(types, scope, true);
    }

    /**
     * Entries of the requested types in the requested scope, in manifest order.
     *
     * @param autoSync false serves the persisted catalogs without scanning
     */
    public List<CatalogEntry> listElements(TypeFilter types, ScopeFilter scope, boolean autoSync) {
        List<CatalogEntry> entries = autoSync ? materialize(types.types()) : persisted(types.types());
        return CatalogSearch.filterByScope(entries, scope);
    }

    /**
     * Ranked search over the requested types.
     *
     * @throws SearchException on malformed query input
     */
    public List<ScoredEntry> searchElements(SearchQuery query) {
        return CatalogSearch.search(materialize(query.types().types()), query);
    }

    public Optional<CatalogEntry> getElement(String name, TypeFilter types, boolean fuzzy) {
        return getElement(name, types, ScopeFilter.ALL, fuzzy);
    }

    /**
     * Look up one element by name.
     *
     * An exact, case-insensitive match wins (a command's leading '/' is
     * optional); when several scopes define the name, the most specific scope
     * (local, then project, then global) is returned. With {@code fuzzy} and
     * no exact match, the best search hit is returned if it scores at least
     * the configured threshold.
     */
    public Optional<CatalogEntry> getElement(String name, TypeFilter types, ScopeFilter scope, boolean fuzzy) {
        if (name == null || name.isBlank()) {
            throw new SearchException("Element name must not be blank");
        }
        List<CatalogEntry> candidates = CatalogSearch.filterByScope(materialize(types.types()), scope);

        String wanted = CatalogEntries.matchName(name);
        Optional<CatalogEntry> exact = candidates.stream()
                .filter(e -> CatalogEntries.matchName(e.name()).equals(wanted))
                .min(Comparator.comparingInt((CatalogEntry e) -> e.scope().precedence())
                        .thenComparing(CatalogEntry::elementType));
        if (exact.isPresent() || !fuzzy) {
            return exact;
        }

        SearchQuery best = new SearchQuery(name, types, scope, List.of(), 1);
        return CatalogSearch.search(candidates, best).stream()
                .filter(hit -> hit.score() >= fuzzyMinScore)
                .map(ScoredEntry::entry)
                .findFirst();
    }

    // ------------------------------------------------------------------
    // Sync
    // ------------------------------------------------------------------

    /**
     * Reconcile the manifests of {@code types} (all types when null or empty)
     * with the filesystem.
     *
     * @param force ignore cached results and rescan every requested type
     */
    public SyncResult syncCatalogs(Set<ElementType> types, boolean force) {
        return sync(types, force).result();
    }

    /** Drop every cached catalog; the next read syncs again. */
    public void invalidate() {
        cache.clear();
    }

    private SyncOutcome sync(Set<ElementType> requested, boolean force) {
        Set<ElementType> types = requested == null || requested.isEmpty()
                ? EnumSet.allOf(ElementType.class) : EnumSet.copyOf(requested);

        Map<ElementType, TypeSyncReport>     reports  = new EnumMap<>(ElementType.class);
        Map<ElementType, List<CatalogEntry>> entries  = new EnumMap<>(ElementType.class);
        Set<ElementType>                     failed   = EnumSet.noneOf(ElementType.class);
        List<String>                         warnings = new ArrayList<>();

        // Scans are pure reads over disjoint subtrees: run them side by side,
        // then merge and save one type at a time.
        Map<ElementType, Future<ScanResult>> scans = new EnumMap<>(ElementType.class);
        Instant now = clock.instant();
        for (ElementType type : types) {
            CachedCatalog cached = force ? null : fresh(type, now);
            if (cached != null) {
                reports.put(type, TypeSyncReport.fromCache(type, cached.entries().size()));
                entries.put(type, cached.entries());
            } else {
                scans.put(type, scanPool.submit(() -> scanner.scan(type, ScopeFilter.ALL)));
            }
        }

        for (Map.Entry<ElementType, Future<ScanResult>> scan : scans.entrySet()) {
            ElementType type = scan.getKey();
            MDC.put(MDC_ELEMENT_TYPE, type.key());
            Timer.Sample sample = Timer.start(meterRegistry);
            String status = "success";
            try {
                reports.put(type, syncType(type, await(scan.getValue()), warnings, entries));
            } catch (RuntimeException e) {
                status = "error";
                failed.add(type);
                warnings.add(type.plural() + ": " + e.getMessage());
                log.error("Sync of {} failed, serving the persisted catalog: {}", type.plural(), e.getMessage(), e);
                entries.put(type, syncer.loadCatalog(type).catalog().entries());
            } finally {
                sample.stop(meterRegistry.timer("catalog.sync.duration", "type", type.key()));
                meterRegistry.counter("catalog.sync.runs", "type", type.key(), "status", status).increment();
                MDC.remove(MDC_ELEMENT_TYPE);
            }
        }

        return new SyncOutcome(new SyncResult(reports, failed, warnings), entries);
    }

    private TypeSyncReport syncType(ElementType type, ScanResult scanned,
                                    List<String> warnings,
                                    Map<ElementType, List<CatalogEntry>> entries) {
        LoadResult loaded = syncer.loadCatalog(type);
        warnings.addAll(loaded.warnings());
        warnings.addAll(scanned.warnings());
        if (scanned.skipped() > 0) {
            meterRegistry.counter("catalog.scan.skipped", "type", type.key()).increment(scanned.skipped());
        }

        MergeResult merged = syncer.mergeEntries(loaded.catalog().entries(), scanned.entries());
        merged.nameConflicts().forEach((key, count) ->
                warnings.add(type.plural() + ": name '" + key + "' is defined " + count + " times"));

        Instant now = clock.instant();
        syncer.saveCatalog(loaded.catalog().withEntries(merged.entries(), now));

        cache.put(type, new CachedCatalog(merged.entries(), now));
        entries.put(type, merged.entries());
        log.info("Synced {}: {} discovered, {} added, {} updated, {} retained, {} total",
                type.plural(), scanned.entries().size(),
                merged.added(), merged.updated(), merged.retained(), merged.entries().size());
        return new TypeSyncReport(type, scanned.entries().size(),
                merged.added(), merged.updated(), merged.retained(), merged.entries().size(), false);
    }

    private static ScanResult await(Future<ScanResult> scan) {
        try {
            return scan.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScanException("Interrupted while waiting for scan", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ScanException("Scan failed: " + e.getCause(), e.getCause());
        }
    }

    // ------------------------------------------------------------------
    // Statistics
    // ------------------------------------------------------------------

    /** Counts over the persisted catalogs; does not scan. */
    public CatalogStats stats() {
        Map<ElementType, Integer> byType  = new EnumMap<>(ElementType.class);
        Map<Scope, Integer>       byScope = new EnumMap<>(Scope.class);
        for (Scope scope : Scope.values()) {
            byScope.put(scope, 0);
        }
        int total = 0;
        for (ElementType type : ElementType.values()) {
            List<CatalogEntry> entries = syncer.loadCatalog(type).catalog().entries();
            byType.put(type, entries.size());
            total += entries.size();
            for (CatalogEntry e : entries) {
                byScope.merge(e.scope(), 1, Integer::sum);
            }
        }
        return new CatalogStats(total, byType, byScope);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private List<CatalogEntry> materialize(Set<ElementType> types) {
        return flatten(types, sync(types, false).entries());
    }

    private List<CatalogEntry> persisted(Set<ElementType> types) {
        Map<ElementType, List<CatalogEntry>> entries = new EnumMap<>(ElementType.class);
        Instant now = clock.instant();
        for (ElementType type : types) {
            CachedCatalog cached = fresh(type, now);
            entries.put(type, cached != null ? cached.entries() : syncer.loadCatalog(type).catalog().entries());
        }
        return flatten(types, entries);
    }

    private static List<CatalogEntry> flatten(Set<ElementType> types, Map<ElementType, List<CatalogEntry>> byType) {
        List<CatalogEntry> out = new ArrayList<>();
        for (ElementType type : EnumSet.copyOf(types)) {
            out.addAll(byType.getOrDefault(type, List.of()));
        }
        return out;
    }

    private CachedCatalog fresh(ElementType type, Instant now) {
        CachedCatalog cached = cache.get(type);
        if (cached == null) return null;
        return Duration.between(cached.syncedAt(), now).compareTo(cacheTtl) < 0 ? cached : null;
    }

    @Override
    public void close() {
        scanPool.shutdownNow();
    }
}
