package org.dxworks.pageframe.model.validation;

import java.util.List;

/**
 * An asset url that could not be checked, such as a relative url with no base
 * url to resolve it against.
 */
public class UnverifiedAsset {
    public final AssetType type;
    public final String url;
    public final List<String> usedIn;
    public final String reason;

    public UnverifiedAsset(AssetType type, String url, List<String> usedIn, String reason) {
        this.type = type;
        this.url = url;
        this.usedIn = List.copyOf(usedIn);
        this.reason = reason;
    }
}
