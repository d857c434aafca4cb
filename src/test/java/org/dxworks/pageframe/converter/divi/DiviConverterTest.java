package org.dxworks.pageframe.converter.divi;

import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiviConverterTest {

    @Test
    void columns_snapToDiviFractions() {
        ConverterOutput output = TestUtils.convert(new DiviConverter(), TestUtils.twoColumnPage());
        DiviExport export = (DiviExport) output.exportData;

        DiviElement section = export.sections.get(0);
        assertEquals("et_pb_section", section.type);
        DiviElement row = section.children.get(0);
        assertEquals("et_pb_row", row.type);
        assertEquals("1_3,2_3", row.attrs.get("column_structure"));
        assertEquals(List.of("1_3", "2_3"), row.children.stream().map(column -> column.attrs.get("type")).toList());

        DiviElement text = row.children.get(0).children.get(0);
        assertEquals("et_pb_text", text.type);
        assertEquals("<h2>Left</h2>", text.content);
        assertTrue(export.postContent.contains("[et_pb_row column_structure=\"1_3,2_3\""));
        assertTrue(export.postContent.contains("<h2>Left</h2>[/et_pb_text]"));
    }

    @Test
    void nearestFraction_isChosen() {
        assertEquals("1_2", DiviConverter.ColumnType.nearest(48).id);
        assertEquals("1_4", DiviConverter.ColumnType.nearest(26).id);
        assertEquals("4_4", DiviConverter.ColumnType.nearest(100).id);
    }
}
