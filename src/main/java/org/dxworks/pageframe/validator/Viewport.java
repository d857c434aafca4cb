package org.dxworks.pageframe.validator;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Viewport {
    DESKTOP("desktop", 1920, 1080),
    LAPTOP("laptop", 1366, 768),
    TABLET("tablet", 768, 1024),
    MOBILE("mobile", 375, 667);

    private final String id;
    private final int width;
    private final int height;

    Viewport(String id, int width, int height) {
        this.id = id;
        this.width = width;
        this.height = height;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
