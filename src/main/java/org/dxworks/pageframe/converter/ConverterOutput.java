package org.dxworks.pageframe.converter;

import org.dxworks.pageframe.model.FallbackStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ConverterOutput {
    public final Object exportData;
    public final List<FallbackStrategy> fallbacks;
    public final int nativeWidgets;
    public final int htmlFallbacks;
    public final Map<String, String> nodeMapping; // IR node id -> native id
    public final List<String> nativeIds;          // every emitted native id, in emission order

    public ConverterOutput(Object exportData,
                           List<FallbackStrategy> fallbacks,
                           int nativeWidgets,
                           int htmlFallbacks,
                           Map<String, String> nodeMapping,
                           List<String> nativeIds) {
        this.exportData = exportData;
        this.fallbacks = List.copyOf(fallbacks);
        this.nativeWidgets = nativeWidgets;
        this.htmlFallbacks = htmlFallbacks;
        this.nodeMapping = Collections.unmodifiableMap(new LinkedHashMap<>(nodeMapping));
        this.nativeIds = List.copyOf(nativeIds);
    }
}
