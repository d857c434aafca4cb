package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Builder-neutral intermediate representation consumed by every target
 * converter. Synthetic nodes are rows, columns and sections created by
 * grouping; they stand for no DOM element.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ComponentHierarchy {
    public final NodeKind type;
    public final ComponentType componentType;
    public final String id;
    public final String tagName; // null for synthetic nodes
    public final ComponentProps props;
    public final ExtractedStyles styles;
    public final ResponsiveStyles responsiveStyles;
    public final InteractiveStates interactiveStates;
    public final List<ComponentHierarchy> children;
    public final int confidence;
    public final boolean manualReviewNeeded;
    public final String reviewReason;
    public final boolean synthetic;
    public final Double columnSize; // percent, column nodes only
    public final String originalHtml;

    private ComponentHierarchy(Builder builder) {
        this.type = builder.type;
        this.componentType = builder.componentType;
        this.id = builder.id;
        this.tagName = builder.tagName;
        this.props = builder.props != null ? builder.props : new ComponentProps();
        this.styles = builder.styles != null ? builder.styles : ExtractedStyles.EMPTY;
        this.responsiveStyles = builder.responsiveStyles;
        this.interactiveStates = builder.interactiveStates;
        this.children = List.copyOf(builder.children);
        this.confidence = builder.confidence;
        this.manualReviewNeeded = builder.manualReviewNeeded;
        this.reviewReason = builder.reviewReason;
        this.synthetic = builder.synthetic;
        this.columnSize = builder.columnSize;
        this.originalHtml = builder.originalHtml;
    }

    public boolean isWidget() {
        return type == NodeKind.WIDGET;
    }

    /**
     * Pre-order count of nodes in this subtree, this node included.
     */
    public int nodeCount() {
        int count = 1;
        for (ComponentHierarchy child : children) {
            count += child.nodeCount();
        }
        return count;
    }

    /**
     * True when some widget sits in this subtree.
     */
    public boolean hasWidgets() {
        if (isWidget()) {
            return true;
        }
        for (ComponentHierarchy child : children) {
            if (child.hasWidgets()) {
                return true;
            }
        }
        return false;
    }

    public ComponentHierarchy withChildren(List<ComponentHierarchy> children) {
        Builder copy = copy();
        copy.children = children;
        return copy.build();
    }

    public ComponentHierarchy withColumnSize(double columnSize) {
        return copy().columnSize(columnSize).build();
    }

    private Builder copy() {
        Builder copy = new Builder(type, componentType, id);
        copy.tagName = tagName;
        copy.props = props;
        copy.styles = styles;
        copy.responsiveStyles = responsiveStyles;
        copy.interactiveStates = interactiveStates;
        copy.children = children;
        copy.confidence = confidence;
        copy.manualReviewNeeded = manualReviewNeeded;
        copy.reviewReason = reviewReason;
        copy.synthetic = synthetic;
        copy.columnSize = columnSize;
        copy.originalHtml = originalHtml;
        return copy;
    }

    public static Builder builder(NodeKind type, ComponentType componentType, String id) {
        return new Builder(type, componentType, id);
    }

    public static class Builder {
        private final NodeKind type;
        private final ComponentType componentType;
        private final String id;
        private String tagName;
        private ComponentProps props;
        private ExtractedStyles styles;
        private ResponsiveStyles responsiveStyles;
        private InteractiveStates interactiveStates;
        private List<ComponentHierarchy> children = List.of();
        private int confidence = 100;
        private boolean manualReviewNeeded;
        private String reviewReason;
        private boolean synthetic;
        private Double columnSize;
        private String originalHtml;

        private Builder(NodeKind type, ComponentType componentType, String id) {
            this.type = type;
            this.componentType = componentType;
            this.id = id;
        }

        public Builder fromElement(AnalyzedElement element) {
            this.tagName = element.tagName;
            this.styles = element.styles;
            this.responsiveStyles = element.responsiveStyles;
            this.interactiveStates = element.interactiveStates;
            this.originalHtml = element.outerHTML;
            return this;
        }

        public Builder props(ComponentProps props) {
            this.props = props;
            return this;
        }

        public Builder children(List<ComponentHierarchy> children) {
            this.children = children;
            return this;
        }

        public Builder confidence(int confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder manualReview(String reason) {
            this.manualReviewNeeded = true;
            this.reviewReason = reason;
            return this;
        }

        public Builder synthetic() {
            this.synthetic = true;
            return this;
        }

        public Builder columnSize(double columnSize) {
            this.columnSize = columnSize;
            return this;
        }

        public ComponentHierarchy build() {
            return new ComponentHierarchy(this);
        }
    }
}
