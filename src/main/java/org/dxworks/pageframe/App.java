package org.dxworks.pageframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.pageframe.dom.DomSnapshot;
import org.dxworks.pageframe.dom.DomSnapshotReader;
import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.PageBuilder;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

public class App {
    static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar pageframe.jar <input-file> <output-file> [builder...]");
            System.err.println("  <input-file>:  DOM snapshot (.json) or HTML page (.html, .htm)");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.err.println("  [builder...]:  Target builders (default: builders from pageframe-config.yml)");
            System.err.println("Supported builders: " + String.join(", ", BuilderRegistry.allBuilderNames()));
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        PageframeConfig config = PageframeConfig.load();
        List<PageBuilder> builders;
        try {
            builders = args.length > 2
                    ? BuilderRegistry.resolve(Arrays.asList(args).subList(2, args.length))
                    : config.getBuilders();
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(2);
            return;
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting page conversion...");
        System.out.println("Input: " + input.toAbsolutePath());
        System.out.println("Builders: " + builders.stream().map(PageBuilder::getName).collect(Collectors.joining(", ")));

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("builders", builders);
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            ConversionPipeline pipeline = new ConversionPipeline();
            ConversionPipeline.AnalyzedPage page = null;
            try {
                DomSnapshot snapshot = new DomSnapshotReader().read(input);
                page = pipeline.analyze(snapshot.root, config.getMinConfidence());
                System.out.println("Recognized " + page.components.size() + " elements");
            } catch (IOException | RuntimeException e) {
                for (PageBuilder builder : builders) {
                    writeError(writer, input, builder, e);
                    errorCount.incrementAndGet();
                }
                System.err.println("  Error reading " + input.getFileName() + ": " + e.getMessage());
            }

            if (page != null) {
                ConversionPipeline.AnalyzedPage analyzed = page;
                builders.parallelStream().forEach(builder -> {
                    int current = progressCounter.incrementAndGet();
                    synchronized (System.out) {
                        System.out.println("[" + current + "/" + builders.size() + "] Converting to "
                                + builder.getName());
                    }

                    try {
                        ConversionResult result = pipeline.convert(analyzed, config.toOptions(builder));

                        // Write result immediately (synchronized to avoid concurrent writes)
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(result));
                            writer.newLine();
                            writer.flush();
                        }

                        successCount.incrementAndGet();
                    } catch (Exception e) {
                        try {
                            writeError(writer, input, builder, e);
                        } catch (IOException ioException) {
                            System.err.println("Failed to write error for " + builder.getName() + ": "
                                    + ioException.getMessage());
                        }

                        errorCount.incrementAndGet();
                        synchronized (System.err) {
                            System.err.println("  Error converting to " + builder.getName() + ": " + e.getMessage());
                        }
                    }
                });
            }

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("builders_converted", successCount.get());
            doneInfo.put("builders_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + successCount.get() + " builders");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static void writeError(BufferedWriter writer, Path input, PageBuilder builder, Exception e)
            throws IOException {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", input.toString());
        error.put("builder", builder.getName());
        error.put("error", e.getMessage());
        synchronized (writer) {
            writer.write(MAPPER.writeValueAsString(error));
            writer.newLine();
            writer.flush();
        }
    }
}
