package org.dxworks.pageframe;

import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.PageBuilder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PageframeConfigTest {

    @TempDir
    Path tempDir;

    private Path write(String yaml) throws IOException {
        Path file = tempDir.resolve("pageframe-config.yml");
        Files.writeString(file, yaml);
        return file;
    }

    @Test
    void missingFile_givesDefaults() {
        PageframeConfig config = PageframeConfig.load(tempDir.resolve("absent.yml"));

        assertEquals(60, config.getMinConfidence());
        assertTrue(config.isFallbackToHtml());
        assertTrue(config.isOptimizeAssets());
        assertEquals(List.of(PageBuilder.values()), config.getBuilders());
        assertEquals(30_000, config.getValidationTimeoutMillis());
        assertEquals(4, config.getMaxConcurrentRenders());
    }

    @Test
    void yamlValues_overrideDefaults() throws IOException {
        PageframeConfig config = PageframeConfig.load(write(
                "minConfidence: 75\n"
                        + "fallbackToHtml: false\n"
                        + "includeAnimations: true\n"
                        + "optimizeAssets: false\n"
                        + "builders: [divi, Gutenberg, divi]\n"
                        + "validationTimeoutMillis: 5000\n"
                        + "somethingElse: ignored\n"));

        assertEquals(75, config.getMinConfidence());
        assertFalse(config.isFallbackToHtml());
        assertTrue(config.isIncludeAnimations());
        assertTrue(config.isIncludeResponsive());
        assertFalse(config.isOptimizeAssets());
        assertFalse(config.toOptions(PageBuilder.DIVI).optimizeAssets);
        assertEquals(List.of(PageBuilder.DIVI, PageBuilder.GUTENBERG), config.getBuilders());
        assertEquals(5000, config.getValidationTimeoutMillis());
    }

    @Test
    void invalidValues_fallBackPerField() throws IOException {
        PageframeConfig config = PageframeConfig.load(write(
                "minConfidence: 150\n"
                        + "maxConcurrentRenders: 0\n"
                        + "builders: []\n"));

        assertEquals(60, config.getMinConfidence());
        assertEquals(4, config.getMaxConcurrentRenders());
        assertEquals(List.of(PageBuilder.values()), config.getBuilders());
    }

    @Test
    void unknownBuilder_discardsTheFile() throws IOException {
        PageframeConfig config = PageframeConfig.load(write("minConfidence: 90\nbuilders: [wix]\n"));

        assertEquals(60, config.getMinConfidence());
        assertEquals(List.of(PageBuilder.values()), config.getBuilders());
    }

    @Test
    void toOptions_carriesTheSwitches() {
        ConversionOptions options = PageframeConfig.with(150, false, List.of(PageBuilder.BEAVER))
                .toOptions(PageBuilder.BEAVER);

        assertEquals(PageBuilder.BEAVER, options.targetBuilder);
        assertEquals(100, options.minConfidence);
        assertFalse(options.fallbackToHTML);
        assertTrue(options.preserveCustomCSS);
    }
}
