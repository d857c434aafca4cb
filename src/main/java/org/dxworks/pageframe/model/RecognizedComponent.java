package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

public class RecognizedComponent {
    public final String id;
    public final ComponentType componentType;
    public final RecognitionResult recognition;
    public final String tagName;
    @JsonIgnore
    public final AnalyzedElement element;
    public final ComponentProps props;
    public final List<RecognizedComponent> children;

    public RecognizedComponent(String id, RecognitionResult recognition, AnalyzedElement element,
                               ComponentProps props, List<RecognizedComponent> children) {
        this.id = id;
        this.componentType = recognition.componentType;
        this.recognition = recognition;
        this.tagName = element.tagName;
        this.element = element;
        this.props = props;
        this.children = List.copyOf(children);
    }
}
