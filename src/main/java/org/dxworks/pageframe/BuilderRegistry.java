package org.dxworks.pageframe;

import org.dxworks.pageframe.converter.TargetConverter;
import org.dxworks.pageframe.converter.beaver.BeaverConverter;
import org.dxworks.pageframe.converter.bricks.BricksConverter;
import org.dxworks.pageframe.converter.divi.DiviConverter;
import org.dxworks.pageframe.converter.elementor.ElementorConverter;
import org.dxworks.pageframe.converter.gutenberg.GutenbergConverter;
import org.dxworks.pageframe.converter.oxygen.OxygenConverter;
import org.dxworks.pageframe.model.PageBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

public class BuilderRegistry {

    public static Set<String> allBuilderNames() {
        return Arrays.stream(PageBuilder.values())
            .map(PageBuilder::getName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    /**
     * Resolves builder names in the given order, dropping duplicates.
     *
     * @throws IllegalArgumentException for a name no converter supports
     */
    public static List<PageBuilder> resolve(List<String> names) {
        Set<PageBuilder> builders = new LinkedHashSet<>();
        for (String name : names) {
            builders.add(PageBuilder.fromName(name.trim()));
        }
        return new ArrayList<>(builders);
    }

    public static Map<PageBuilder, TargetConverter> buildConverters(List<PageBuilder> builders) {
        Map<PageBuilder, TargetConverter> converters = new EnumMap<>(PageBuilder.class);
        for (PageBuilder builder : builders) {
            converters.put(builder, createConverter(builder));
        }
        return converters;
    }

    /**
     * A new converter for the builder. Converters keep no state between runs,
     * but each call still returns a fresh instance.
     */
    public static TargetConverter createConverter(PageBuilder builder) {
        return switch (builder) {
            case ELEMENTOR -> new ElementorConverter();
            case GUTENBERG -> new GutenbergConverter();
            case BEAVER -> new BeaverConverter();
            case DIVI -> new DiviConverter();
            case BRICKS -> new BricksConverter();
            case OXYGEN -> new OxygenConverter();
        };
    }
}
