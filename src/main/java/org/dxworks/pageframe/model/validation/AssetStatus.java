package org.dxworks.pageframe.model.validation;

import java.util.ArrayList;
import java.util.List;

public class AssetStatus {
    public int total;
    public int verified;
    public int missing;
    public int broken;
    public int unverified;
    public List<String> urls = new ArrayList<>();
}
