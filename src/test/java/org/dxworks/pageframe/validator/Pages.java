package org.dxworks.pageframe.validator;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Rendered pages and renderers for validator tests.
 */
final class Pages {

    private Pages() {
    }

    static byte[] png(int width, int height, Color fill, int blackColumns) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = image.createGraphics();
        graphics.setColor(fill);
        graphics.fillRect(0, 0, width, height);
        graphics.setColor(Color.BLACK);
        graphics.fillRect(0, 0, blackColumns, height);
        graphics.dispose();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    static RenderedPage white(int width, int height) {
        return new RenderedPage(png(width, height, Color.WHITE, 0), width, height,
                Map.of("h1", Map.of("color", "rgb(0, 0, 0)")));
    }

    /** Renders every page as the same blank white screenshot. */
    static PageRenderer blankRenderer() {
        return (html, viewport) -> CompletableFuture.completedFuture(white(8, 8));
    }

    /** Never completes. */
    static PageRenderer hangingRenderer() {
        return (html, viewport) -> new CompletableFuture<>();
    }
}
