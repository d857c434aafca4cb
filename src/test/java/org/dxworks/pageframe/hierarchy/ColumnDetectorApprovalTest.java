package org.dxworks.pageframe.hierarchy;

import org.approvaltests.Approvals;
import org.dxworks.pageframe.TestUtils;
import org.dxworks.pageframe.analyzer.ElementAnalyzer;
import org.dxworks.pageframe.model.AnalyzedElement;
import org.junit.jupiter.api.Test;

import static org.dxworks.pageframe.dom.DomNode.element;

public class ColumnDetectorApprovalTest {

    @Test
    public void describesAmbiguousRow() throws Exception {
        AnalyzedElement row = new ElementAnalyzer().analyze(element("div").child(
                element("div").attr("class", "col-6").child(element("p").text("Half")),
                element("div").attr("class", "col-3").child(element("p").text("Quarter"))));

        ColumnDetector.Partition partition = new ColumnDetector().partition(row, row.children);

        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(partition));
    }
}
