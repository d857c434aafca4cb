package org.dxworks.pageframe.model.validation;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class BrokenAsset {
    public final AssetType type;
    public final String url;
    public final String error;
    public final Integer statusCode;
    public final List<String> usedIn;

    public BrokenAsset(AssetType type, String url, String error, Integer statusCode, List<String> usedIn) {
        this.type = type;
        this.url = url;
        this.error = error;
        this.statusCode = statusCode;
        this.usedIn = List.copyOf(usedIn);
    }
}
