package org.dxworks.pageframe.converter.gutenberg;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class BlockSerializerApprovalTest {

    @Test
    void serializesNestedColumns() {
        Map<String, Object> imageAttrs = new LinkedHashMap<>();
        imageAttrs.put("url", "https://cdn.example.com/flex.png");
        imageAttrs.put("alt", "Flexible");

        GutenbergBlock left = new GutenbergBlock("core/column", Map.of("width", "50%"), List.of(
                GutenbergBlock.leaf("core/heading", Map.of("level", 2), "<h2 class=\"wp-block-heading\">Fast</h2>"),
                GutenbergBlock.leaf("core/paragraph", Map.of(), "<p>Renders in milliseconds.</p>")),
                "<div class=\"wp-block-column\" style=\"flex-basis:50%\"></div>");
        GutenbergBlock right = new GutenbergBlock("core/column", Map.of("width", "50%"), List.of(
                GutenbergBlock.leaf("core/image", imageAttrs,
                        "<figure class=\"wp-block-image size-large\"><img src=\"https://cdn.example.com/flex.png\" alt=\"Flexible\"/></figure>")),
                "<div class=\"wp-block-column\" style=\"flex-basis:50%\"></div>");
        GutenbergBlock columns = new GutenbergBlock("core/columns", Map.of("isStackedOnMobile", true),
                List.of(left, right), "<div class=\"wp-block-columns\"></div>");

        Approvals.verify(BlockSerializer.serialize(List.of(columns,
                GutenbergBlock.leaf("core/separator", Map.of(), ""))));
    }
}
