package com.elementcatalog.search;

import com.elementcatalog.model.CatalogEntries;
import com.elementcatalog.model.CatalogEntry;
import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Filter, score and rank catalog entries.
 *
 * Pure functions over an already materialized list: no I/O, inputs are
 * never modified, and the same input always yields the same order.
 *
 * <p>Scoring for a non-blank query:
 * <pre>
 *   +100  name equals the whole query (case-insensitive, command '/' ignored)
 *   +50   name contains any token
 *   +10   per token found in the description
 *   +20   per entry tag equal to a token
 * </pre>
 * Entries scoring 0 are not returned. Ties are broken by name.
 */
public final class CatalogSearch {

    static final int EXACT_NAME        = 100;
    static final int NAME_TOKEN        = 50;
    static final int DESCRIPTION_TOKEN = 10;
    static final int TAG_TOKEN         = 20;

    static final Comparator<CatalogEntry> BY_NAME = Comparator
            .comparing((CatalogEntry e) -> e.name().toLowerCase(Locale.ROOT))
            .thenComparing(CatalogEntry::name);

    private static final Comparator<ScoredEntry> RANKING = Comparator
            .comparingInt(ScoredEntry::score).reversed()
            .thenComparing(ScoredEntry::entry, BY_NAME);

    private CatalogSearch() {}

    // ------------------------------------------------------------------
    // Search
    // ------------------------------------------------------------------

    public static List<ScoredEntry> search(List<? extends CatalogEntry> entries, SearchQuery query) {
        List<? extends CatalogEntry> candidates = filterByTags(
                filterByScope(filterByType(entries, query.types()), query.scopes()),
                query.tags());

        List<String> tokens = tokenize(query.text());
        if (tokens.isEmpty()) {
            return candidates.stream()
                    .sorted(BY_NAME)
                    .limit(query.limit())
                    .map(e -> new ScoredEntry(e, 0))
                    .toList();
        }

        String whole = CatalogEntries.matchName(query.text());
        List<ScoredEntry> hits = new ArrayList<>();
        for (CatalogEntry entry : candidates) {
            int score = score(entry, whole, tokens);
            if (score > 0) {
                hits.add(new ScoredEntry(entry, score));
            }
        }
        hits.sort(RANKING);
        return hits.size() > query.limit() ? List.copyOf(hits.subList(0, query.limit())) : List.copyOf(hits);
    }

    /** Lower-cased whitespace tokens, duplicates removed, in query order. */
    public static List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();
        Set<String> tokens = new LinkedHashSet<>(
                Arrays.asList(text.strip().toLowerCase(Locale.ROOT).split("\\s+")));
        return List.copyOf(tokens);
    }

    static int score(CatalogEntry entry, String wholeQuery, List<String> tokens) {
        String name        = CatalogEntries.matchName(entry.name());
        String description = entry.description().toLowerCase(Locale.ROOT);

        int score = 0;
        if (name.equals(wholeQuery)) {
            score += EXACT_NAME;
        }
        if (tokens.stream().anyMatch(name::contains)) {
            score += NAME_TOKEN;
        }
        for (String token : tokens) {
            if (description.contains(token)) {
                score += DESCRIPTION_TOKEN;
            }
        }
        for (String tag : new LinkedHashSet<>(CatalogEntries.tags(entry))) {
            if (tokens.contains(tag.toLowerCase(Locale.ROOT))) {
                score += TAG_TOKEN;
            }
        }
        return score;
    }

    // ------------------------------------------------------------------
    // Filters
    // ------------------------------------------------------------------

    public static <E extends CatalogEntry> List<E> filterByType(List<E> entries, TypeFilter filter) {
        return entries.stream().filter(e -> filter.matches(e.elementType())).toList();
    }

    public static <E extends CatalogEntry> List<E> filterByScope(List<E> entries, ScopeFilter filter) {
        return entries.stream().filter(e -> filter.matches(e.scope())).toList();
    }

    /** Keeps entries carrying every tag in {@code required}; no tags keeps everything. */
    public static <E extends CatalogEntry> List<E> filterByTags(List<E> entries, List<String> required) {
        if (required.isEmpty()) return List.copyOf(entries);
        Set<String> wanted = lowerCase(required);
        return entries.stream()
                .filter(e -> lowerCase(CatalogEntries.tags(e)).containsAll(wanted))
                .toList();
    }

    private static Set<String> lowerCase(List<String> values) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : values) out.add(v.strip().toLowerCase(Locale.ROOT));
        return out;
    }
}
