package org.dxworks.pageframe.validator;

import java.util.concurrent.CompletableFuture;

/**
 * Browser capability used by the validator. Implementations load an HTML
 * string or URL at the given viewport and complete with its screenshot and
 * computed styles, or complete exceptionally when the page cannot be rendered.
 */
public interface PageRenderer {

    CompletableFuture<RenderedPage> render(String htmlOrUrl, Viewport viewport);
}
