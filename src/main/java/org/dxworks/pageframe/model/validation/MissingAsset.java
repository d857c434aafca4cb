package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class MissingAsset {
    public final AssetType type;
    public final String url;
    public final List<String> usedIn;
    public final Severity severity;
    public final String suggestion;

    public MissingAsset(AssetType type, String url, List<String> usedIn, Severity severity, String suggestion) {
        this.type = type;
        this.url = url;
        this.usedIn = List.copyOf(usedIn);
        this.severity = severity;
        this.suggestion = suggestion;
    }
}
