package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecognitionResult {
    public final ComponentType componentType;
    public final int confidence; // 0-100
    public final List<String> matchedPatterns;
    public final ComponentType fallbackType; // nullable
    public final boolean manualReviewNeeded;
    public final String reason;

    public RecognitionResult(ComponentType componentType, int confidence, List<String> matchedPatterns,
                             ComponentType fallbackType, boolean manualReviewNeeded, String reason) {
        this.componentType = componentType;
        this.confidence = confidence;
        this.matchedPatterns = List.copyOf(matchedPatterns);
        this.fallbackType = fallbackType;
        this.manualReviewNeeded = manualReviewNeeded;
        this.reason = reason;
    }

    public static RecognitionResult unknown(String reason) {
        return new RecognitionResult(ComponentType.UNKNOWN, 0, List.of(), null, true, reason);
    }
}
