package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class FallbackStrategy {
    public enum Strategy {
        HTML_WIDGET("html-widget"),
        CUSTOM_CSS("custom-css"),
        IMAGE_REPLACEMENT("image-replacement"),
        MANUAL_REVIEW("manual-review");

        private final String id;

        Strategy(String id) {
            this.id = id;
        }

        @JsonValue
        public String getId() {
            return id;
        }
    }

    public final Strategy strategy;
    public final String nodeId;
    public final String reason;
    public final String originalHTML;
    public final List<String> suggestions;
    public final ComponentType alternativeComponentType;

    public FallbackStrategy(Strategy strategy, String nodeId, String reason, String originalHTML,
                            List<String> suggestions, ComponentType alternativeComponentType) {
        this.strategy = strategy;
        this.nodeId = nodeId;
        this.reason = reason;
        this.originalHTML = originalHTML;
        this.suggestions = List.copyOf(suggestions);
        this.alternativeComponentType = alternativeComponentType;
    }
}
