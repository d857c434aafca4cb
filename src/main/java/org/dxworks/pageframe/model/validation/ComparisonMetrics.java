package org.dxworks.pageframe.model.validation;

import java.util.ArrayList;
import java.util.List;

public class ComparisonMetrics {
    public double colorDifference; // average channel diff 0-255
    public List<String> missingElements = new ArrayList<>();
    public List<String> extraElements = new ArrayList<>();
    public List<StyleDiscrepancy> styleDiscrepancies = new ArrayList<>();
}
