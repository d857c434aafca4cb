package org.dxworks.pageframe.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum PageBuilder {
    ELEMENTOR("elementor"),
    GUTENBERG("gutenberg"),
    BEAVER("beaver"),
    DIVI("divi"),
    BRICKS("bricks"),
    OXYGEN("oxygen");

    private final String name;

    PageBuilder(String name) {
        this.name = name;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    @JsonCreator
    public static PageBuilder fromName(String name) {
        for (PageBuilder builder : values()) {
            if (builder.name.equalsIgnoreCase(name) || builder.name().equalsIgnoreCase(name)) {
                return builder;
            }
        }
        throw new IllegalArgumentException("Unsupported page builder: " + name + " (supported: "
                + Arrays.stream(values()).map(PageBuilder::getName).collect(Collectors.joining(", ")) + ")");
    }
}
