package org.dxworks.pageframe;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.PageBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class PageframeConfig {

    private static final String CONFIG_FILE_NAME = "pageframe-config.yml";
    private static final int DEFAULT_MIN_CONFIDENCE = ConversionOptions.DEFAULT_MIN_CONFIDENCE;
    private static final long DEFAULT_VALIDATION_TIMEOUT_MILLIS = 30_000;
    private static final int DEFAULT_MAX_CONCURRENT_RENDERS = 4;

    private final int minConfidence;
    private final boolean fallbackToHtml;
    private final boolean includeResponsive;
    private final boolean includeAnimations;
    private final boolean preserveCustomCss;
    private final boolean optimizeAssets;
    private final List<PageBuilder> builders;
    private final long validationTimeoutMillis;
    private final int maxConcurrentRenders;

    private PageframeConfig(int minConfidence, boolean fallbackToHtml, boolean includeResponsive,
                            boolean includeAnimations, boolean preserveCustomCss, boolean optimizeAssets,
                            List<PageBuilder> builders, long validationTimeoutMillis, int maxConcurrentRenders) {
        this.minConfidence = minConfidence;
        this.fallbackToHtml = fallbackToHtml;
        this.includeResponsive = includeResponsive;
        this.includeAnimations = includeAnimations;
        this.preserveCustomCss = preserveCustomCss;
        this.optimizeAssets = optimizeAssets;
        this.builders = List.copyOf(builders);
        this.validationTimeoutMillis = validationTimeoutMillis;
        this.maxConcurrentRenders = maxConcurrentRenders;
    }

    public int getMinConfidence() {
        return minConfidence;
    }

    public boolean isFallbackToHtml() {
        return fallbackToHtml;
    }

    public boolean isIncludeResponsive() {
        return includeResponsive;
    }

    public boolean isIncludeAnimations() {
        return includeAnimations;
    }

    public boolean isPreserveCustomCss() {
        return preserveCustomCss;
    }

    public boolean isOptimizeAssets() {
        return optimizeAssets;
    }

    public List<PageBuilder> getBuilders() {
        return builders;
    }

    public long getValidationTimeoutMillis() {
        return validationTimeoutMillis;
    }

    public int getMaxConcurrentRenders() {
        return maxConcurrentRenders;
    }

    /**
     * Conversion options for one target, with this configuration's switches.
     */
    public ConversionOptions toOptions(PageBuilder target) {
        return new ConversionOptions(target, preserveCustomCss, includeResponsive, includeAnimations,
                optimizeAssets, minConfidence, fallbackToHtml);
    }

    public static PageframeConfig defaults() {
        return new PageframeConfig(DEFAULT_MIN_CONFIDENCE, true, true, false, true, true,
                List.of(PageBuilder.values()), DEFAULT_VALIDATION_TIMEOUT_MILLIS, DEFAULT_MAX_CONCURRENT_RENDERS);
    }

    public static PageframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static PageframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Warning: ignoring " + configPath + ": " + e.getMessage());
        }

        return defaults();
    }

    private static PageframeConfig fromYaml(YamlConfig yaml) {
        PageframeConfig defaults = defaults();
        int effectiveMinConfidence = (yaml.minConfidence != null && yaml.minConfidence >= 0 && yaml.minConfidence <= 100)
                ? yaml.minConfidence
                : defaults.minConfidence;
        List<PageBuilder> effectiveBuilders = (yaml.builders != null && !yaml.builders.isEmpty())
                ? BuilderRegistry.resolve(yaml.builders)
                : defaults.builders;
        long effectiveTimeout = (yaml.validationTimeoutMillis != null && yaml.validationTimeoutMillis > 0)
                ? yaml.validationTimeoutMillis
                : defaults.validationTimeoutMillis;
        int effectiveRenders = (yaml.maxConcurrentRenders != null && yaml.maxConcurrentRenders > 0)
                ? yaml.maxConcurrentRenders
                : defaults.maxConcurrentRenders;

        return new PageframeConfig(
                effectiveMinConfidence,
                yaml.fallbackToHtml != null ? yaml.fallbackToHtml : defaults.fallbackToHtml,
                yaml.includeResponsive != null ? yaml.includeResponsive : defaults.includeResponsive,
                yaml.includeAnimations != null ? yaml.includeAnimations : defaults.includeAnimations,
                yaml.preserveCustomCss != null ? yaml.preserveCustomCss : defaults.preserveCustomCss,
                yaml.optimizeAssets != null ? yaml.optimizeAssets : defaults.optimizeAssets,
                effectiveBuilders,
                effectiveTimeout,
                effectiveRenders);
    }

    public static PageframeConfig with(int minConfidence, boolean fallbackToHtml, List<PageBuilder> builders) {
        PageframeConfig defaults = defaults();
        int effectiveMinConfidence = Math.max(0, Math.min(100, minConfidence));
        List<PageBuilder> effectiveBuilders = builders.isEmpty() ? defaults.builders : builders;
        return new PageframeConfig(effectiveMinConfidence, fallbackToHtml, defaults.includeResponsive,
                defaults.includeAnimations, defaults.preserveCustomCss, defaults.optimizeAssets,
                effectiveBuilders, defaults.validationTimeoutMillis, defaults.maxConcurrentRenders);
    }

    private static class YamlConfig {
        public Integer minConfidence;
        public Boolean fallbackToHtml;
        public Boolean includeResponsive;
        public Boolean includeAnimations;
        public Boolean preserveCustomCss;
        public Boolean optimizeAssets;
        public List<String> builders;
        public Long validationTimeoutMillis;
        public Integer maxConcurrentRenders;
    }
}
