package org.dxworks.pageframe.converter;

import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.FallbackStrategy;
import org.dxworks.pageframe.model.design.ColorPalette;
import org.dxworks.pageframe.model.design.DesignTokens;
import org.dxworks.pageframe.model.typography.TypographySystem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of a single conversion run: ids, fallbacks, node mapping and
 * counters. Never shared between runs.
 */
public final class ConversionContext {
    public final ConversionOptions options;
    public final TypographySystem typography;
    public final DesignTokens designTokens;

    private final IdGenerator ids;
    private final List<FallbackStrategy> fallbacks = new ArrayList<>();
    private final Map<String, String> nodeMapping = new LinkedHashMap<>();
    private final List<String> nativeIds = new ArrayList<>();
    private int nativeWidgets;
    private int htmlFallbacks;

    public ConversionContext(ConversionOptions options, TypographySystem typography, DesignTokens designTokens,
                             IdGenerator ids) {
        this.options = options;
        this.typography = typography;
        this.designTokens = designTokens;
        this.ids = ids;
    }

    /**
     * Allocates a native id for an IR node and records the mapping.
     */
    public String register(ComponentHierarchy node) {
        String id = emit();
        nodeMapping.put(node.id, id);
        return id;
    }

    /**
     * Allocates a native id for an element that has no IR counterpart.
     */
    public String emit() {
        String id = ids.next();
        nativeIds.add(id);
        return id;
    }

    /**
     * Maps an IR node onto an already emitted native element, for nodes the
     * target format folds into their parent.
     */
    public void bind(ComponentHierarchy node, String nativeId) {
        nodeMapping.put(node.id, nativeId);
    }

    public void addFallback(FallbackStrategy fallback) {
        fallbacks.add(fallback);
    }

    void countNative() {
        nativeWidgets++;
    }

    void countHtmlFallback() {
        htmlFallbacks++;
    }

    /**
     * Global color slot for a normalized color, or null when the page has no
     * palette or the color is not part of it.
     */
    public String colorSlot(String color) {
        if (designTokens == null) {
            return null;
        }
        ColorPalette palette = designTokens.colors;
        return palette != null ? palette.slotOf(color) : null;
    }

    public ConverterOutput toOutput(Object exportData) {
        return new ConverterOutput(exportData, fallbacks, nativeWidgets, htmlFallbacks, nodeMapping, nativeIds);
    }
}
