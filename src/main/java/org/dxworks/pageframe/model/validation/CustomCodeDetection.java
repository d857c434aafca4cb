package org.dxworks.pageframe.model.validation;

import java.util.ArrayList;
import java.util.List;

public class CustomCodeDetection {
    public boolean hasCustomJS;
    public boolean hasCustomCSS;
    public boolean canBeConverted;
    public List<ConversionWarning> conversionWarnings = new ArrayList<>();
    public List<DetectedFeature> detectedFeatures = new ArrayList<>();
    public List<Incompatibility> incompatibilities = new ArrayList<>();
    public int conversionScore; // 0-100

    public long blockingCount() {
        return incompatibilities.stream().filter(i -> i.impact == Incompatibility.Impact.BLOCKING).count();
    }
}
