package com.sintajournals.scraper;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view over one element of a rendered listing page and its descendants.
 * <p>
 * Implementations hide the concrete DOM representation. Lookups never return null: absent
 * elements and attributes are reported as empty {@link Optional}s or empty lists.
 *
 * @author SINTA Journals Scraper Team
 * @since 1.0
 */
public interface MarkupFragment {

    /**
     * Finds the first descendant matching the marker, in document order.
     * @param marker structural marker
     * @return the first match, or empty if none
     */
    Optional<MarkupFragment> findFirst(Marker marker);

    /**
     * Finds every descendant matching the marker, in document order.
     * @param marker structural marker
     * @return all matches, possibly empty
     */
    List<MarkupFragment> findAll(Marker marker);

    /**
     * Looks up an attribute of this element.
     * @param name attribute name
     * @return the attribute value, or empty if the attribute is not present
     */
    Optional<String> attribute(String name);

    /**
     * @return the whitespace-normalized text of this element and its descendants
     */
    String text();
}
