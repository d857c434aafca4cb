package org.dxworks.pageframe.recognizer;

import org.dxworks.pageframe.model.AnalyzedElement;
import org.dxworks.pageframe.model.ComponentProps;
import org.dxworks.pageframe.model.ComponentType;
import org.dxworks.pageframe.model.RecognitionResult;
import org.dxworks.pageframe.model.RecognizedComponent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Classifies analyzed elements against a priority-ordered pattern table. The
 * first pattern whose conditions all hold wins and its confidence is reported
 * as is.
 */
public class ComponentRecognizer {

    private final List<RecognitionPattern> patterns;

    public ComponentRecognizer() {
        this(PatternCatalog.patterns());
    }

    public ComponentRecognizer(List<RecognitionPattern> patterns) {
        List<RecognitionPattern> sorted = new ArrayList<>(patterns);
        sorted.sort(Comparator.comparingInt((RecognitionPattern p) -> p.priority).reversed());
        this.patterns = List.copyOf(sorted);
    }

    public RecognitionResult recognize(AnalyzedElement element, int minConfidence) {
        for (RecognitionPattern pattern : patterns) {
            if (!pattern.matches(element)) {
                continue;
            }
            if (pattern.confidence < minConfidence) {
                return new RecognitionResult(pattern.componentType, pattern.confidence, List.of(pattern.id),
                        ComponentType.UNKNOWN, true,
                        "Matched " + pattern.id + " with " + pattern.confidence
                                + "% confidence, below the " + minConfidence + "% minimum");
            }
            return new RecognitionResult(pattern.componentType, pattern.confidence, List.of(pattern.id),
                    null, false, "Matched " + pattern.id + " with " + pattern.confidence + "% confidence");
        }
        return RecognitionResult.unknown("No pattern matched <" + element.tagName + ">");
    }

    /**
     * Recognizes every element of the tree. Component ids follow pre-order
     * ({@code el-0} is the root).
     */
    public RecognizedComponent recognizeTree(AnalyzedElement root, int minConfidence) {
        return recognizeTree(root, minConfidence, new int[]{0});
    }

    private RecognizedComponent recognizeTree(AnalyzedElement element, int minConfidence, int[] counter) {
        String id = "el-" + counter[0]++;
        RecognitionResult result = recognize(element, minConfidence);
        ComponentProps props = PropsExtractor.extract(element, result.componentType);

        List<RecognizedComponent> children = new ArrayList<>();
        for (AnalyzedElement child : element.children) {
            children.add(recognizeTree(child, minConfidence, counter));
        }
        return new RecognizedComponent(id, result, element, props, children);
    }

    /**
     * Pre-order list of a recognized tree.
     */
    public static List<RecognizedComponent> flatten(RecognizedComponent root) {
        List<RecognizedComponent> all = new ArrayList<>();
        flatten(root, all);
        return all;
    }

    private static void flatten(RecognizedComponent component, List<RecognizedComponent> into) {
        into.add(component);
        for (RecognizedComponent child : component.children) {
            flatten(child, into);
        }
    }
}
