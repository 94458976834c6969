package com.sintajournals.scraper;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link MarkupFragment} backed by a jsoup {@link Element}.
 */
public final class JsoupMarkupFragment implements MarkupFragment {
    private final Element element;

    public JsoupMarkupFragment(Element element) {
        this.element = Objects.requireNonNull(element, "element");
    }

    /**
     * Parses a full page of markup.
     * @param html page markup
     * @return fragment rooted at the document
     */
    public static MarkupFragment parse(String html) {
        Objects.requireNonNull(html, "html");
        Document document = Jsoup.parse(html);
        return new JsoupMarkupFragment(document);
    }

    @Override
    public Optional<MarkupFragment> findFirst(Marker marker) {
        Element match = element.selectFirst(marker.toCssQuery());
        return Optional.ofNullable(match).map(JsoupMarkupFragment::new);
    }

    @Override
    public List<MarkupFragment> findAll(Marker marker) {
        return element.select(marker.toCssQuery()).stream()
            .map(JsoupMarkupFragment::new)
            .collect(Collectors.toList());
    }

    @Override
    public Optional<String> attribute(String name) {
        return element.hasAttr(name) ? Optional.of(element.attr(name)) : Optional.empty();
    }

    @Override
    public String text() {
        return element.text();
    }

    @Override
    public String toString() {
        return "<" + element.tagName() + " class=\"" + element.className() + "\">";
    }
}
