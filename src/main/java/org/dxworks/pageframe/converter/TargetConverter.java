package org.dxworks.pageframe.converter;

import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.PageBuilder;
import org.dxworks.pageframe.model.design.DesignTokens;
import org.dxworks.pageframe.model.typography.TypographySystem;

import java.util.List;

public interface TargetConverter {
    PageBuilder builder();

    ConverterOutput convert(List<ComponentHierarchy> roots,
                            TypographySystem typography,
                            DesignTokens designTokens,
                            ConversionOptions options);
}
