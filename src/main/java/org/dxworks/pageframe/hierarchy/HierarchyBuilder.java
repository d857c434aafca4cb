package org.dxworks.pageframe.hierarchy;

import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.NodeKind;
import org.dxworks.pageframe.model.RecognizedComponent;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a recognized tree into the builder-neutral section / container / row /
 * column / widget hierarchy.
 * <p>
 * The recognized root is the page itself and yields no node. Layout
 * components become sections at the top level and containers below it; any
 * other component becomes a widget that keeps its whole subtree as markup.
 * Node ids ({@code node-N}) are handed out in pre-order.
 */
public class HierarchyBuilder {

    private final ColumnDetector columnDetector;

    public HierarchyBuilder() {
        this(new ColumnDetector());
    }

    public HierarchyBuilder(ColumnDetector columnDetector) {
        this.columnDetector = columnDetector;
    }

    public List<ComponentHierarchy> build(RecognizedComponent page) {
        if (page == null) {
            throw new IllegalArgumentException("DOM root must not be null");
        }
        return new Walk().topLevel(page);
    }

    /**
     * One build pass; owns the id counter.
     */
    private final class Walk {
        private int counter;

        private String nextId() {
            return "node-" + counter++;
        }

        List<ComponentHierarchy> topLevel(RecognizedComponent page) {
            List<RecognizedComponent> children = page.children;
            if (children.isEmpty()) {
                return List.of();
            }

            ColumnDetector.Partition partition = columnDetector.partition(page.element, elementsOf(children));
            if (partition.kind == ColumnDetector.Kind.COLUMNS && children.size() > 1) {
                String sectionId = nextId();
                List<ComponentHierarchy> rows = columnRows(children, partition);
                return List.of(syntheticNode(NodeKind.SECTION, ComponentType.SECTION, sectionId)
                        .children(rows)
                        .build());
            }

            List<ComponentHierarchy> sections = new ArrayList<>();
            List<RecognizedComponent> pendingWidgets = new ArrayList<>();
            for (RecognizedComponent child : children) {
                if (isLayout(child)) {
                    if (!pendingWidgets.isEmpty()) {
                        sections.add(widgetSection(pendingWidgets));
                        pendingWidgets = new ArrayList<>();
                    }
                    sections.add(layoutNode(child, NodeKind.SECTION));
                } else {
                    pendingWidgets.add(child);
                }
            }
            if (!pendingWidgets.isEmpty()) {
                sections.add(widgetSection(pendingWidgets));
            }
            return sections;
        }

        private ComponentHierarchy widgetSection(List<RecognizedComponent> widgets) {
            String sectionId = nextId();
            ComponentHierarchy row = singleColumnRow(widgets, null);
            return syntheticNode(NodeKind.SECTION, ComponentType.SECTION, sectionId)
                    .children(List.of(row))
                    .build();
        }

        private ComponentHierarchy layoutNode(RecognizedComponent component, NodeKind kind) {
            String id = nextId();
            ComponentHierarchy.Builder builder = elementNode(kind, component, id);
            List<RecognizedComponent> children = component.children;
            if (children.isEmpty()) {
                return builder.build();
            }

            ColumnDetector.Partition partition = columnDetector.partition(component.element, elementsOf(children));
            List<ComponentHierarchy> rows = switch (partition.kind) {
                case COLUMNS -> columnRows(children, partition);
                case SINGLE -> List.of(singleColumnRow(children, null));
                case AMBIGUOUS -> List.of(singleColumnRow(children, partition.reason));
            };
            return builder.children(rows).build();
        }

        /**
         * One row per visual row of the partition; wrapped grids give several.
         */
        private List<ComponentHierarchy> columnRows(List<RecognizedComponent> children,
                                                    ColumnDetector.Partition partition) {
            List<ComponentHierarchy> rows = new ArrayList<>();
            int start = 0;
            for (int length : partition.rowLengths) {
                rows.add(columnsRow(children.subList(start, start + length),
                        partition.sizes.subList(start, start + length)));
                start += length;
            }
            return rows;
        }

        private ComponentHierarchy columnsRow(List<RecognizedComponent> children, List<Double> sizes) {
            String rowId = nextId();
            List<ComponentHierarchy> columns = new ArrayList<>();
            for (int i = 0; i < children.size(); i++) {
                RecognizedComponent child = children.get(i);
                double size = sizes.get(i);
                if (isLayout(child)) {
                    String columnId = nextId();
                    columns.add(elementNode(NodeKind.COLUMN, child, columnId)
                            .columnSize(size)
                            .children(columnContent(child))
                            .build());
                } else {
                    String columnId = nextId();
                    columns.add(syntheticNode(NodeKind.COLUMN, ComponentType.COLUMN, columnId)
                            .columnSize(size)
                            .children(List.of(widgetNode(child)))
                            .build());
                }
            }
            return syntheticNode(NodeKind.ROW, ComponentType.ROW, rowId).children(columns).build();
        }

        private ComponentHierarchy singleColumnRow(List<RecognizedComponent> children, String ambiguity) {
            String rowId = nextId();
            String columnId = nextId();
            ComponentHierarchy column = syntheticNode(NodeKind.COLUMN, ComponentType.COLUMN, columnId)
                    .columnSize(100)
                    .children(contentNodes(children))
                    .build();
            ComponentHierarchy.Builder row = syntheticNode(NodeKind.ROW, ComponentType.ROW, rowId)
                    .children(List.of(column));
            if (ambiguity != null) {
                row.manualReview("Column layout is ambiguous: " + ambiguity);
            }
            return row.build();
        }

        /**
         * Content of a column element: a nested row when its own children form
         * columns, else its children as containers and widgets.
         */
        private List<ComponentHierarchy> columnContent(RecognizedComponent column) {
            List<RecognizedComponent> children = column.children;
            if (children.size() > 1) {
                ColumnDetector.Partition partition = columnDetector.partition(column.element, elementsOf(children));
                if (partition.kind == ColumnDetector.Kind.COLUMNS) {
                    String containerId = nextId();
                    List<ComponentHierarchy> rows = columnRows(children, partition);
                    return List.of(syntheticNode(NodeKind.CONTAINER, ComponentType.CONTAINER, containerId)
                            .children(rows)
                            .build());
                }
            }
            return contentNodes(children);
        }

        private List<ComponentHierarchy> contentNodes(List<RecognizedComponent> children) {
            List<ComponentHierarchy> nodes = new ArrayList<>();
            for (RecognizedComponent child : children) {
                nodes.add(isLayout(child) ? layoutNode(child, NodeKind.CONTAINER) : widgetNode(child));
            }
            return nodes;
        }

        private ComponentHierarchy widgetNode(RecognizedComponent component) {
            return elementNode(NodeKind.WIDGET, component, nextId()).build();
        }
    }

    private static ComponentHierarchy.Builder elementNode(NodeKind kind, RecognizedComponent component, String id) {
        ComponentHierarchy.Builder builder = ComponentHierarchy.builder(kind, component.componentType, id)
                .fromElement(component.element)
                .props(component.props)
                .confidence(component.recognition.confidence);
        if (component.recognition.manualReviewNeeded) {
            builder.manualReview(component.recognition.reason);
        }
        return builder;
    }

    private static ComponentHierarchy.Builder syntheticNode(NodeKind kind, ComponentType type, String id) {
        return ComponentHierarchy.builder(kind, type, id).synthetic();
    }

    private static boolean isLayout(RecognizedComponent component) {
        return component.componentType.isLayout();
    }

    private static List<AnalyzedElement> elementsOf(List<RecognizedComponent> components) {
        List<AnalyzedElement> elements = new ArrayList<>();
        for (RecognizedComponent component : components) {
            elements.add(component.element);
        }
        return elements;
    }
}
