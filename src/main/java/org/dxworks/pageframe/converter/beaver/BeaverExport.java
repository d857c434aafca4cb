package org.dxworks.pageframe.converter.beaver;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Layout data in Beaver Builder's flat form: every node keyed by id, plus
 * the ordered child ids of each parent. Rows are children of {@link #ROOT}.
 */
public class BeaverExport {
    public static final String ROOT = "root";

    public final Map<String, BeaverNode> nodes;
    public final Map<String, List<String>> nodeOrder;
    public final Map<String, Object> colorScheme;
    public final Map<String, Object> typography;

    public BeaverExport(Map<String, BeaverNode> nodes, Map<String, List<String>> nodeOrder,
                        Map<String, Object> colorScheme, Map<String, Object> typography) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(nodes));
        this.nodeOrder = Collections.unmodifiableMap(new LinkedHashMap<>(nodeOrder));
        this.colorScheme = colorScheme;
        this.typography = typography;
    }

    public List<String> childrenOf(String parent) {
        return nodeOrder.getOrDefault(parent, List.of());
    }
}
