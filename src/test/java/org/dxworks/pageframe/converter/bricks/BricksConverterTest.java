package org.dxworks.pageframe.converter.bricks;

import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BricksConverterTest {

    @Test
    void elements_areFlatWithParentLinks() {
        ConverterOutput output = TestUtils.convert(new BricksConverter(), TestUtils.twoColumnPage());
        BricksExport export = (BricksExport) output.exportData;

        assertEquals(List.of("section", "block", "div", "heading", "div", "text-basic"),
                export.elements.stream().map(element -> element.name).toList());

        BricksElement section = export.elements.get(0);
        assertEquals(BricksElement.ROOT_PARENT, section.parent);
        BricksElement row = export.elements.get(1);
        assertEquals(List.of(row.id), section.children);

        List<BricksElement> columns = export.childrenOf(row.id);
        assertEquals("33.33%", columns.get(0).settings.get("_width"));
        assertEquals("66.67%", columns.get(1).settings.get("_width"));

        BricksElement heading = export.elements.get(3);
        assertEquals(columns.get(0).id, heading.parent);
        assertEquals("Left", heading.settings.get("text"));
        assertEquals("h2", heading.settings.get("tag"));
    }

    @Test
    void parents_precedeChildren() {
        ConverterOutput output = TestUtils.convert(new BricksConverter(), TestUtils.landingPage());
        BricksExport export = (BricksExport) output.exportData;

        Set<String> seen = new HashSet<>();
        seen.add(BricksElement.ROOT_PARENT);
        for (BricksElement element : export.elements) {
            assertTrue(seen.contains(element.parent), () -> element.id + " appears before its parent");
            assertTrue(element.id.matches("[0-9a-z]{6}"));
            seen.add(element.id);
        }
    }
}
