package org.dxworks.pageframe.recognizer;

import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ComponentType;

import java.util.List;

/**
 * A recognition rule: it matches only when every declared condition holds.
 */
public class RecognitionPattern {
    public final String id;
    public final ComponentType componentType;
    public final int confidence; // 0-100
    public final int priority;   // higher checked first
    public final List<PatternCondition> conditions;

    public RecognitionPattern(String id, ComponentType componentType, int confidence, int priority,
                              List<PatternCondition> conditions) {
        if (conditions.isEmpty()) {
            throw new IllegalArgumentException("Pattern " + id + " declares no condition");
        }
        this.id = id;
        this.componentType = componentType;
        this.confidence = confidence;
        this.priority = priority;
        this.conditions = List.copyOf(conditions);
    }

    public static RecognitionPattern of(String id, ComponentType type, int confidence, int priority,
                                        PatternCondition... conditions) {
        return new RecognitionPattern(id, type, confidence, priority, List.of(conditions));
    }

    public boolean matches(AnalyzedElement element) {
        for (PatternCondition condition : conditions) {
            if (!condition.test(element)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return id + " -> " + componentType.getId() + " (" + confidence + "%, priority " + priority + ")";
    }
}
