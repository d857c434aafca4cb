package org.dxworks.pageframe.dom;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public enum InputFormat {
    JSON("json"),
    HTML("html");

    private final String name;

    InputFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static Optional<InputFormat> detect(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);

        if (fileName.endsWith(".json")) {
            return Optional.of(JSON);
        } else if (fileName.endsWith(".html") || fileName.endsWith(".htm")) {
            return Optional.of(HTML);
        }

        return Optional.empty();
    }
}
