package org.dxworks.pageframe;

import org.dxworks.pageframe.converter.TargetConverter;
import org.dxworks.pageframe.model.PageBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuilderRegistryTest {

    @Test
    void allBuilderNames_listsEveryTarget() {
        assertEquals(List.of("elementor", "gutenberg", "beaver", "divi", "bricks", "oxygen"),
                List.copyOf(BuilderRegistry.allBuilderNames()));
    }

    @Test
    void resolve_isCaseInsensitiveAndDropsDuplicates() {
        assertEquals(List.of(PageBuilder.BRICKS, PageBuilder.ELEMENTOR),
                BuilderRegistry.resolve(List.of(" bricks", "ELEMENTOR", "Bricks")));
    }

    @Test
    void resolve_rejectsUnknownBuilders() {
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> BuilderRegistry.resolve(List.of("elementor", "wix")));
        assertTrue(error.getMessage().startsWith("Unsupported page builder: wix"));
    }

    @Test
    void createConverter_returnsAFreshConverterPerCall() {
        for (PageBuilder builder : PageBuilder.values()) {
            TargetConverter converter = BuilderRegistry.createConverter(builder);
            assertEquals(builder, converter.builder());
            assertNotSame(converter, BuilderRegistry.createConverter(builder));
        }
    }

    @Test
    void buildConverters_coversRequestedBuilders() {
        Map<PageBuilder, TargetConverter> converters =
                BuilderRegistry.buildConverters(List.of(PageBuilder.DIVI, PageBuilder.OXYGEN));

        assertEquals(2, converters.size());
        assertEquals(PageBuilder.OXYGEN, converters.get(PageBuilder.OXYGEN).builder());
    }
}
