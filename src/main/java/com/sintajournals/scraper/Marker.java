package com.sintajournals.scraper;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Structural marker used to locate elements inside a {@link MarkupFragment}.
 * <p>
 * A marker matches an element whose tag equals {@code tag} (any tag when {@code tag} is null)
 * and whose class attribute contains every class in {@code classes}. An optional attribute
 * predicate requires {@code attributeName} to contain {@code attributeSubstring}.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public record Marker(String tag, Set<String> classes, String attributeName, String attributeSubstring) {

    public Marker {
        classes = classes == null ? Set.of() : Set.copyOf(classes);
        if ((attributeName == null) != (attributeSubstring == null)) {
            throw new IllegalArgumentException("attributeName and attributeSubstring must be given together");
        }
    }

    /**
     * Marker for {@code tag} carrying all of the given classes.
     */
    public static Marker of(String tag, String... classes) {
        return new Marker(tag, new LinkedHashSet<>(Arrays.asList(classes)), null, null);
    }

    /**
     * Marker for any element carrying all of the given classes.
     */
    public static Marker anyTag(String... classes) {
        return of(null, classes);
    }

    /**
     * Marker for {@code tag} whose attribute {@code name} contains {@code substring}.
     */
    public static Marker withAttributeContaining(String tag, String name, String substring) {
        return new Marker(tag, Set.of(), Objects.requireNonNull(name), Objects.requireNonNull(substring));
    }

    /**
     * Renders this marker as a CSS query understood by jsoup.
     */
    public String toCssQuery() {
        StringBuilder query = new StringBuilder(tag == null ? "" : tag);
        // Set.copyOf has no stable order; sort so the query is deterministic
        classes.stream().sorted().forEach(c -> query.append('.').append(c));
        if (attributeName != null) {
            query.append('[').append(attributeName).append("*=").append(attributeSubstring).append(']');
        }
        return query.length() == 0 ? "*" : query.toString();
    }

    @Override
    public String toString() {
        return toCssQuery();
    }
}
