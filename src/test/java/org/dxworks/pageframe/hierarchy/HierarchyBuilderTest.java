package org.dxworks.pageframe.hierarchy;

import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.analyzer.ElementAnalyzer;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.NodeKind;
import org.dxworks.pageframe.recognizer.ComponentRecognizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.pageframe.dom.DomNode.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HierarchyBuilderTest {

    private static List<ComponentHierarchy> build(DomNode root) {
        return new HierarchyBuilder().build(
                new ComponentRecognizer().recognizeTree(new ElementAnalyzer().analyze(root), 60));
    }

    @Test
    void twoHalfColumns_becomeOneRowOfFiftyFifty() {
        List<ComponentHierarchy> hierarchy = build(element("div").child(
                element("div").attr("class", "col-6").child(element("h2").text("Left")),
                element("div").attr("class", "col-6").child(element("p").text("Right"))));

        assertEquals(1, hierarchy.size());
        ComponentHierarchy section = hierarchy.get(0);
        assertEquals(NodeKind.SECTION, section.type);
        assertTrue(section.synthetic);

        ComponentHierarchy row = section.children.get(0);
        assertEquals(NodeKind.ROW, row.type);
        assertEquals(2, row.children.size());
        for (ComponentHierarchy column : row.children) {
            assertEquals(NodeKind.COLUMN, column.type);
            assertEquals(50.0, column.columnSize);
            assertEquals(NodeKind.WIDGET, column.children.get(0).type);
        }
        assertEquals(ComponentType.HEADING, row.children.get(0).children.get(0).componentType);
        assertEquals(ComponentType.PARAGRAPH, row.children.get(1).children.get(0).componentType);
    }

    @Test
    void looseWidgets_areWrappedInASingleColumnSection() {
        List<ComponentHierarchy> hierarchy = build(element("div").child(
                element("h1").text("Title"), element("p").text("Body")));

        ComponentHierarchy section = hierarchy.get(0);
        ComponentHierarchy column = section.children.get(0).children.get(0);
        assertEquals(100.0, column.columnSize);
        assertEquals(2, column.children.size());
        assertEquals(List.of("node-0", "node-1", "node-2", "node-3", "node-4"),
                List.of(section.id, section.children.get(0).id, column.id,
                        column.children.get(0).id, column.children.get(1).id));
    }

    @Test
    void layoutChildren_becomeSectionsAndWidgetsKeepTheirSubtree() {
        List<ComponentHierarchy> hierarchy = build(TestUtils.landingPage());

        assertEquals(NodeKind.SECTION, hierarchy.get(0).type);
        assertEquals(ComponentType.HERO, hierarchy.get(0).componentType);
        assertFalse(hierarchy.get(0).synthetic);

        ComponentHierarchy form = hierarchy.stream()
                .flatMap(section -> section.children.stream())
                .flatMap(row -> row.children.stream())
                .flatMap(column -> column.children.stream())
                .filter(node -> node.componentType == ComponentType.FORM)
                .findFirst()
                .orElseThrow();
        assertTrue(form.isWidget());
        assertTrue(form.children.isEmpty());
        assertTrue(form.originalHtml.contains("<button type=\"submit\">Send</button>"));
    }

    @Test
    void ambiguousColumns_areFlaggedForReview() {
        List<ComponentHierarchy> hierarchy = build(element("div").child(
                element("section").child(
                        element("div").attr("class", "col-6").child(element("p").text("A")),
                        element("div").child(element("p").text("B")))));

        ComponentHierarchy row = hierarchy.get(0).children.get(0);
        assertTrue(row.manualReviewNeeded);
        assertEquals(1, row.children.size());
    }

    private static List<ComponentHierarchy> rowsOf(List<ComponentHierarchy> nodes) {
        List<ComponentHierarchy> rows = new ArrayList<>();
        for (ComponentHierarchy node : nodes) {
            if (node.type == NodeKind.ROW) {
                rows.add(node);
            }
            if (!node.isWidget()) {
                rows.addAll(rowsOf(node.children));
            }
        }
        return rows;
    }

    private static List<Double> columnSizes(ComponentHierarchy row) {
        return row.children.stream().map(column -> column.columnSize).toList();
    }

    @Test
    void wrapperWithCardLikeContent_keepsItsColumns() {
        List<ComponentHierarchy> hierarchy = build(element("body").child(
                element("div").attr("class", "container").child(
                        element("div").attr("class", "row").child(
                                element("div").attr("class", "col-6").child(
                                        element("h2").text("Fast"),
                                        element("p").text("Renders in milliseconds.")),
                                element("div").attr("class", "col-6").child(
                                        element("img").attr("src", "https://cdn.example.com/fast.png"))))));

        assertEquals(ComponentType.CONTAINER, hierarchy.get(0).componentType);
        ComponentHierarchy columns = rowsOf(hierarchy).stream()
                .filter(row -> row.children.size() == 2)
                .findFirst()
                .orElseThrow();
        assertEquals(List.of(50.0, 50.0), columnSizes(columns));
        assertEquals(ComponentType.HEADING, columns.children.get(0).children.get(0).componentType);
        assertEquals(ComponentType.IMAGE, columns.children.get(1).children.get(0).componentType);
    }

    @Test
    void pricingSection_keepsItsPlanColumns() {
        DomNode row = element("div").attr("class", "row");
        for (String plan : List.of("Basic", "Pro", "Team")) {
            row.child(element("div").attr("class", "col-md-4").child(
                    element("h3").text(plan),
                    element("p").text("$9 per month"),
                    element("a").attr("class", "btn").attr("href", "/buy").text("Buy")));
        }

        List<ComponentHierarchy> hierarchy = build(element("body").child(
                element("section").attr("class", "pricing").child(row)));

        assertEquals(ComponentType.SECTION, hierarchy.get(0).componentType);
        ComponentHierarchy plans = rowsOf(hierarchy).stream()
                .filter(candidate -> candidate.children.size() == 3)
                .findFirst()
                .orElseThrow();
        assertEquals(List.of(33.33, 33.33, 33.33), columnSizes(plans));
    }

    @Test
    void wrappedGrid_becomesOneRowPerLine() {
        DomNode grid = element("div").style("display", "grid").style("grid-template-columns", "repeat(3, 1fr)");
        for (int i = 1; i <= 6; i++) {
            grid.child(element("div").child(element("h3").text("Card " + i), element("p").text("Details")));
        }

        List<ComponentHierarchy> hierarchy = build(element("body").child(grid));

        ComponentHierarchy section = hierarchy.get(0);
        assertEquals(ComponentType.GRID, section.componentType);
        assertEquals(2, section.children.size());
        for (ComponentHierarchy line : section.children) {
            assertEquals(NodeKind.ROW, line.type);
            assertFalse(line.manualReviewNeeded);
            assertEquals(List.of(33.33, 33.33, 33.33), columnSizes(line));
        }
    }

    @Test
    void emptyPage_hasNoSections() {
        assertTrue(build(element("div")).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> new HierarchyBuilder().build(null));
    }
}
