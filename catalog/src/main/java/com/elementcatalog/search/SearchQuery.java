package com.elementcatalog.search;

import com.elementcatalog.model.ScopeFilter;
import com.elementcatalog.model.TypeFilter;

import java.util.List;

/**
 * Parameters of one search.
 *
 * @param text   free text, tokenized on whitespace; may be blank
 * @param types  element types to consider
 * @param scopes scopes to consider
 * @param tags   tags an entry must all carry (case-insensitive)
 * @param limit  maximum number of hits returned
 */
public record SearchQuery(
        String      text,
        TypeFilter  types,
        ScopeFilter scopes,
        List<String> tags,
        int         limit) {

    public static final int DEFAULT_LIMIT   = 20;
    public static final int MAX_TEXT_LENGTH = 200;

    public SearchQuery {
        if (text == null) text = "";
        if (text.length() > MAX_TEXT_LENGTH) {
            throw new SearchException("Query exceeds " + MAX_TEXT_LENGTH + " characters");
        }
        if (hasControlCharacters(text)) {
            throw new SearchException("Query contains control characters");
        }
        if (types == null)  types  = TypeFilter.ALL;
        if (scopes == null) scopes = ScopeFilter.ALL;
        if (tags == null) tags = List.of();
        for (String tag : tags) {
            if (tag == null || tag.isBlank() || hasControlCharacters(tag)) {
                throw new SearchException("Invalid tag filter: '" + tag + "'");
            }
        }
        tags = List.copyOf(tags);
        if (limit < 1) {
            throw new SearchException("Limit must be at least 1, was " + limit);
        }
    }

    /** Text-only query over every type and scope with the default limit. */
    public static SearchQuery of(String text) {
        return new SearchQuery(text, TypeFilter.ALL, ScopeFilter.ALL, List.of(), DEFAULT_LIMIT);
    }

    public SearchQuery withTypes(TypeFilter newTypes) {
        return new SearchQuery(text, newTypes, scopes, tags, limit);
    }

    public SearchQuery withScopes(ScopeFilter newScopes) {
        return new SearchQuery(text, types, newScopes, tags, limit);
    }

    public SearchQuery withTags(List<String> newTags) {
        return new SearchQuery(text, types, scopes, newTags, limit);
    }

    public SearchQuery withLimit(int newLimit) {
        return new SearchQuery(text, types, scopes, tags, newLimit);
    }

    private static boolean hasControlCharacters(String s) {
        return s.chars().anyMatch(c -> Character.isISOControl(c) && !Character.isWhitespace(c));
    }
}
