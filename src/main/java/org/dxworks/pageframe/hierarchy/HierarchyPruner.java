package org.dxworks.pageframe.hierarchy;

import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.NodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops sections, containers, rows and columns that hold no widget. Columns
 * left in a row are widened back to 100%.
 */
public class HierarchyPruner {

    public List<ComponentHierarchy> prune(List<ComponentHierarchy> roots) {
        return pruneAll(roots);
    }

    private static List<ComponentHierarchy> pruneAll(List<ComponentHierarchy> nodes) {
        List<ComponentHierarchy> kept = new ArrayList<>();
        for (ComponentHierarchy node : nodes) {
            if (node.hasWidgets()) {
                kept.add(prune(node));
            }
        }
        return kept;
    }

    private static ComponentHierarchy prune(ComponentHierarchy node) {
        if (node.isWidget()) {
            return node;
        }
        List<ComponentHierarchy> children = pruneAll(node.children);
        if (node.type == NodeKind.ROW && children.size() < node.children.size()) {
            children = widen(children);
        }
        return children.equals(node.children) ? node : node.withChildren(children);
    }

    private static List<ComponentHierarchy> widen(List<ComponentHierarchy> columns) {
        double total = 0;
        for (ComponentHierarchy column : columns) {
            if (column.columnSize == null) {
                return columns;
            }
            total += column.columnSize;
        }
        List<ComponentHierarchy> widened = new ArrayList<>();
        for (ComponentHierarchy column : columns) {
            widened.add(column.withColumnSize(Math.round(column.columnSize * 10000.0 / total) / 100.0));
        }
        return widened;
    }
}
