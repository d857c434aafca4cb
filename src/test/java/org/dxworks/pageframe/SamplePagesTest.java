package org.dxworks.pageframe;

import org.dxworks.pageframe.dom.DomSnapshot;
import org.dxworks.pageframe.dom.DomSnapshotReader;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.ConversionState;
import org.dxworks.pageframe.model.NodeKind;
import org.dxworks.pageframe.model.PageBuilder;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SamplePagesTest {

    @ParameterizedTest
    @ValueSource(strings = {"pricing.html", "pricing.json"})
    void pricingPage_convertsForEveryBuilder(String sample) throws IOException {
        DomSnapshot snapshot = new DomSnapshotReader().read(Paths.get("src/test/resources/samples/pages", sample));
        assertEquals("Pricing", snapshot.title);

        Map<PageBuilder, ConversionResult> results = new ConversionPipeline().convertAll(snapshot.root,
                ConversionOptions.defaults(PageBuilder.ELEMENTOR), List.of(PageBuilder.values()));

        for (ConversionResult result : results.values()) {
            assertEquals(ConversionState.DONE, result.state, result.builder::getName);
            assertTrue(result.validation.errors.isEmpty(), result.builder::getName);
        }

        ComponentHierarchy row = findRow(results.get(PageBuilder.GUTENBERG).hierarchy);
        assertNotNull(row);
        assertEquals(3, row.children.size());
        for (ComponentHierarchy column : row.children) {
            assertEquals(NodeKind.COLUMN, column.type);
            assertEquals(33.33, column.columnSize);
        }
    }

    private static ComponentHierarchy findRow(List<ComponentHierarchy> nodes) {
        for (ComponentHierarchy node : nodes) {
            if (node.type == NodeKind.ROW && !node.manualReviewNeeded && node.children.size() > 1) {
                return node;
            }
            ComponentHierarchy nested = findRow(node.children);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }
}
