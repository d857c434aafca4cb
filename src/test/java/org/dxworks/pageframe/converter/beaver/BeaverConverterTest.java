package org.dxworks.pageframe.converter.beaver;

import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BeaverConverterTest {

    @Test
    void layout_isFlattenedIntoNodesAndOrder() {
        ConverterOutput output = TestUtils.convert(new BeaverConverter(), TestUtils.twoColumnPage());
        BeaverExport export = (BeaverExport) output.exportData;

        List<String> rows = export.childrenOf(BeaverExport.ROOT);
        assertEquals(1, rows.size());
        BeaverNode row = export.nodes.get(rows.get(0));
        assertEquals(BeaverNode.Type.ROW, row.type);
        assertNull(row.parent);

        BeaverNode group = export.nodes.get(export.childrenOf(row.node).get(0));
        assertEquals(BeaverNode.Type.COLUMN_GROUP, group.type);
        assertEquals(row.node, group.parent);

        List<String> columns = export.childrenOf(group.node);
        assertEquals(33.33, export.nodes.get(columns.get(0)).settings.get("size"));
        assertEquals(66.67, export.nodes.get(columns.get(1)).settings.get("size"));
        assertEquals(1, export.nodes.get(columns.get(1)).position);

        BeaverNode heading = export.nodes.get(export.childrenOf(columns.get(0)).get(0));
        assertEquals(BeaverNode.Type.MODULE, heading.type);
        assertEquals("heading", heading.settings.get("type"));
        assertEquals("Left", heading.settings.get("heading"));
        assertEquals("h2", heading.settings.get("tag"));
    }

    @Test
    void everyNode_isListedInItsParentsOrder() {
        ConverterOutput output = TestUtils.convert(new BeaverConverter(), TestUtils.landingPage());
        BeaverExport export = (BeaverExport) output.exportData;

        for (BeaverNode node : export.nodes.values()) {
            String parent = node.parent != null ? node.parent : BeaverExport.ROOT;
            assertEquals(node.node, export.childrenOf(parent).get(node.position));
        }
        assertTrue(export.nodes.keySet().containsAll(output.nodeMapping.values()));
    }
}
