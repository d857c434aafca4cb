package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class DetectedFeature {
    public final String type; // javascript, css
    public final String feature;
    public final String description;
    public final boolean isSupported;
    public final String alternative;

    public DetectedFeature(String type, String feature, String description, boolean isSupported,
                           String alternative) {
        this.type = type;
        this.feature = feature;
        this.description = description;
        this.isSupported = isSupported;
        this.alternative = alternative;
    }
}
