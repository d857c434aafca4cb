package org.dxworks.pageframe.model.validation;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class AssetVerificationResult {
    public int totalAssets;
    public int verifiedAssets;
    public List<MissingAsset> missingAssets = new ArrayList<>();
    public List<BrokenAsset> brokenAssets = new ArrayList<>();
    public List<UnverifiedAsset> unverifiedAssets = new ArrayList<>();
    public Map<AssetType, AssetStatus> assetsByType = new EnumMap<>(AssetType.class);
    public int verificationScore; // 0-100
}
