package org.dxworks.pageframe.hierarchy;

import org.dxworks.pageframe.analyzer.ElementAnalyzer;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.AnalyzedElement;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.pageframe.dom.DomNode.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class ColumnDetectorTest {

    private final ColumnDetector detector = new ColumnDetector();

    private ColumnDetector.Partition partition(DomNode parent) {
        AnalyzedElement element = new ElementAnalyzer().analyze(parent);
        return detector.partition(element, element.children);
    }

    private static DomNode column(String cls) {
        return element("div").attr("class", cls).child(element("p").text("Content"));
    }

    @Test
    void bootstrapClasses_becomeColumns() {
        ColumnDetector.Partition partition = partition(element("div").child(column("col-md-4"), column("col-md-8")));

        assertEquals(ColumnDetector.Kind.COLUMNS, partition.kind);
        assertEquals(List.of(33.33, 66.67), partition.sizes);
    }

    @Test
    void unsizedColumns_shareTheRow() {
        ColumnDetector.Partition partition = partition(element("div").child(column("col"), column("col")));

        assertEquals(ColumnDetector.Kind.COLUMNS, partition.kind);
        assertEquals(List.of(50.0, 50.0), partition.sizes);
    }

    @Test
    void percentWidths_becomeColumns() {
        ColumnDetector.Partition partition = partition(element("div").child(
                element("div").style("width", "30%"), element("div").style("width", "70%")));

        assertEquals(List.of(30.0, 70.0), partition.sizes);
    }

    @Test
    void gridTracks_splitEvenly() {
        ColumnDetector.Partition partition = partition(element("div")
                .style("display", "grid").style("grid-template-columns", "repeat(3, 1fr)")
                .child(element("div"), element("div"), element("div")));

        assertEquals(ColumnDetector.Kind.COLUMNS, partition.kind);
        assertEquals(List.of(33.33, 33.33, 33.33), partition.sizes);
    }

    private static DomNode grid(int items) {
        DomNode grid = element("div").style("display", "grid").style("grid-template-columns", "repeat(3, 1fr)");
        for (int i = 0; i < items; i++) {
            grid.child(element("div").child(element("h3").text("Item " + i)));
        }
        return grid;
    }

    @Test
    void gridItems_wrapIntoRowsOfTrackCount() {
        ColumnDetector.Partition partition = partition(grid(6));

        assertEquals(ColumnDetector.Kind.COLUMNS, partition.kind);
        assertEquals(List.of(3, 3), partition.rowLengths);
        assertEquals(List.of(33.33, 33.33, 33.33, 33.33, 33.33, 33.33), partition.sizes);
    }

    @Test
    void gridWithPartialLastRow_keepsTrackWidth() {
        ColumnDetector.Partition partition = partition(grid(7));

        assertEquals(ColumnDetector.Kind.COLUMNS, partition.kind);
        assertEquals(List.of(3, 3, 1), partition.rowLengths);
        assertEquals(33.33, partition.sizes.get(6));
    }

    @Test
    void bootstrapColumns_wrapWhenTheRowIsFull() {
        ColumnDetector.Partition partition = partition(element("div").child(
                column("col-md-6"), column("col-md-6"), column("col-md-6"), column("col-md-6")));

        assertEquals(ColumnDetector.Kind.COLUMNS, partition.kind);
        assertEquals(List.of(2, 2), partition.rowLengths);
        assertEquals(List.of(50.0, 50.0, 50.0, 50.0), partition.sizes);
    }

    @Test
    void unfilledRowBeforeWrap_isAmbiguous() {
        ColumnDetector.Partition partition = partition(element("div").child(
                column("col-md-8"), column("col-md-6"), column("col-md-6")));

        assertEquals(ColumnDetector.Kind.AMBIGUOUS, partition.kind);
        assertEquals("column sizes sum to 116.67%", partition.reason);
    }

    @Test
    void noSignals_isSingleColumn() {
        ColumnDetector.Partition partition = partition(element("div").child(
                element("h2").text("Title"), element("p").text("Body")));

        assertEquals(ColumnDetector.Kind.SINGLE, partition.kind);
    }

    @Test
    void partialSignals_areAmbiguous() {
        ColumnDetector.Partition partition = partition(element("div").child(column("col-6"), element("div")));

        assertEquals(ColumnDetector.Kind.AMBIGUOUS, partition.kind);
        assertNotNull(partition.reason);
    }

    @Test
    void sizesNotAddingUp_areAmbiguous() {
        ColumnDetector.Partition partition = partition(element("div").child(column("col-6"), column("col-3")));

        assertEquals(ColumnDetector.Kind.AMBIGUOUS, partition.kind);
        assertEquals("column sizes sum to 75.0%", partition.reason);
    }

    @Test
    void fullWidth_isNoColumnSignal() {
        ColumnDetector.Partition partition = partition(element("div").child(
                element("div").style("width", "100%"), element("div").style("width", "100%")));

        assertEquals(ColumnDetector.Kind.SINGLE, partition.kind);
    }
}
