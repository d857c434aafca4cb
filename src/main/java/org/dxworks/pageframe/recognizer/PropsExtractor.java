package org.dxworks.pageframe.recognizer;

import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ComponentProps;
import org.dxworks.pageframe.model.ComponentType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Pulls the builder-neutral content of a recognized element into
 * {@link ComponentProps}.
 */
final class PropsExtractor {

    private PropsExtractor() {
    }

    static ComponentProps extract(AnalyzedElement element, ComponentType type) {
        ComponentProps props = new ComponentProps();
        props.textContent = emptyToNull(element.textContent);
        props.innerHTML = emptyToNull(element.innerHTML);
        props.elementId = element.id;
        props.className = element.classes.isEmpty() ? null : String.join(" ", element.classes);
        props.width = element.attr("width");
        props.height = element.attr("height");

        for (Map.Entry<String, String> attribute : element.attributes.entrySet()) {
            if (attribute.getKey().startsWith("data-")) {
                props.dataAttributes.put(attribute.getKey(), attribute.getValue());
            } else if (attribute.getKey().startsWith("aria-")) {
                props.ariaAttributes.put(attribute.getKey(), attribute.getValue());
            }
        }

        AnalyzedElement link = element.isTag("a") ? element : firstDescendant(element, "a");
        if (link != null) {
            props.href = link.attr("href");
            props.target = link.attr("target");
        }

        AnalyzedElement media = element.isTag("img", "video", "iframe", "source") ? element
                : firstDescendant(element, "img", "video", "iframe");
        if (media != null) {
            props.src = media.attr("src");
            props.alt = media.attr("alt");
            props.poster = media.attr("poster");
            if (props.src == null && media.isTag("video")) {
                AnalyzedElement source = firstDescendant(media, "source");
                props.src = source != null ? source.attr("src") : null;
            }
        }

        if (element.isTag("input", "textarea", "select", "button")) {
            props.type = element.attr("type");
            props.name = element.attr("name");
            props.placeholder = element.attr("placeholder");
            props.value = element.attr("value");
            props.required = element.attributes.containsKey("required") ? Boolean.TRUE : null;
        }

        switch (type) {
            case HEADING -> props.headingLevel = headingLevel(element);
            case LIST, MENU, BREADCRUMBS, PAGINATION, TABS, ACCORDION -> {
                props.ordered = element.isTag("ol") ? Boolean.TRUE : null;
                props.items = itemsOf(element);
            }
            case SELECT -> {
                for (AnalyzedElement option : element.children) {
                    if (option.isTag("option")) {
                        props.items.add(option.textContent);
                    }
                }
            }
            case GALLERY, CAROUSEL, SLIDER -> collectImages(element, props.mediaUrls);
            case TABLE -> collectRows(element, props.tableRows);
            default -> {
            }
        }
        return props;
    }

    private static Integer headingLevel(AnalyzedElement element) {
        if (element.tagName.matches("h[1-6]")) {
            return element.tagName.charAt(1) - '0';
        }
        String ariaLevel = element.attr("aria-level");
        if (ariaLevel != null && ariaLevel.matches("[1-6]")) {
            return Integer.parseInt(ariaLevel);
        }
        return 2;
    }

    /**
     * Item texts: list items for lists, link labels for menus, summaries for
     * details-based accordions.
     */
    private static List<String> itemsOf(AnalyzedElement element) {
        List<String> items = new ArrayList<>();
        collectItems(element, items);
        return items;
    }

    private static void collectItems(AnalyzedElement element, List<String> items) {
        for (AnalyzedElement child : element.children) {
            if (child.isTag("li", "dt", "summary", "button") || (child.isTag("a") && !element.isTag("li"))) {
                if (!child.textContent.isBlank()) {
                    items.add(child.textContent);
                }
            } else {
                collectItems(child, items);
            }
        }
    }

    private static void collectImages(AnalyzedElement element, List<String> urls) {
        for (AnalyzedElement child : element.children) {
            if (child.isTag("img") && child.attr("src") != null) {
                urls.add(child.attr("src"));
            } else {
                collectImages(child, urls);
            }
        }
    }

    private static void collectRows(AnalyzedElement element, List<List<String>> rows) {
        for (AnalyzedElement child : element.children) {
            if (child.isTag("tr")) {
                List<String> cells = new ArrayList<>();
                for (AnalyzedElement cell : child.children) {
                    if (cell.isTag("td", "th")) {
                        cells.add(cell.textContent);
                    }
                }
                rows.add(cells);
            } else {
                collectRows(child, rows);
            }
        }
    }

    static AnalyzedElement firstDescendant(AnalyzedElement element, String... tags) {
        for (AnalyzedElement child : element.children) {
            if (child.isTag(tags)) {
                return child;
            }
            AnalyzedElement nested = firstDescendant(child, tags);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
