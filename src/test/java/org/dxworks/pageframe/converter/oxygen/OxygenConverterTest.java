package org.dxworks.pageframe.converter.oxygen;

import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class OxygenConverterTest {

    @Test
    void tree_numbersComponentsInDocumentOrder() {
        ConverterOutput output = TestUtils.convert(new OxygenConverter(), TestUtils.twoColumnPage());
        OxygenExport export = (OxygenExport) output.exportData;

        assertEquals(0, export.tree.id);
        OxygenComponent section = export.components().get(0);
        assertEquals("ct_section", section.name);
        assertEquals(1, section.id);

        OxygenComponent columns = section.children.get(0);
        assertEquals("ct_columns", columns.name);
        OxygenComponent left = columns.children.get(0);
        assertEquals("ct_column", left.name);
        Map<?, ?> original = (Map<?, ?>) left.options.get("original");
        assertEquals(33.33, original.get("width"));
        assertEquals("%", original.get("width-unit"));

        OxygenComponent headline = left.children.get(0);
        assertEquals("ct_headline", headline.name);
        assertEquals(4, headline.id);
        assertEquals(left.id, headline.options.get("ct_parent"));
        assertEquals("Left", headline.options.get("ct_content"));
        assertEquals("headline-4", headline.options.get("selector"));

        assertEquals(List.of("1", "2", "3", "4", "5", "6"), output.nativeIds);
    }

    @Test
    void selector_dropsThePrefix() {
        assertEquals("text-block-12", OxygenConverter.selector("ct_text_block", 12));
        assertEquals("rich-text-3", OxygenConverter.selector("oxy_rich_text", 3));
    }
}
