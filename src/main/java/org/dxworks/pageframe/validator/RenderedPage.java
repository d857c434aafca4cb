package org.dxworks.pageframe.validator;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A page rendered at one viewport: a PNG screenshot and the computed styles
 * of its elements keyed by selector, in document order.
 */
public class RenderedPage {
    public final byte[] screenshot;
    public final int width;
    public final int height;
    public final Map<String, Map<String, String>> styles;

    public RenderedPage(byte[] screenshot, int width, int height, Map<String, Map<String, String>> styles) {
        this.screenshot = screenshot;
        this.width = width;
        this.height = height;
        this.styles = styles != null ? new LinkedHashMap<>(styles) : new LinkedHashMap<>();
    }

    public BufferedImage image() throws IOException {
        if (screenshot == null || screenshot.length == 0) {
            throw new IOException("Rendered page has no screenshot");
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(screenshot));
        if (image == null) {
            throw new IOException("Screenshot is not a readable image");
        }
        return image;
    }
}
