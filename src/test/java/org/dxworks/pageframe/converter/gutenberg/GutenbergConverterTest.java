package org.dxworks.pageframe.converter.gutenberg;

import org.dxworks.pageframe.ConversionPipeline;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.ComponentHierarchy;
import org.dxworks.pageframe.model.ConversionOptions;
import org.dxworks.pageframe.model.ConversionResult;
import org.dxworks.pageframe.model.PageBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.pageframe.dom.DomNode.element;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GutenbergConverterTest {

    private static ConverterOutput convert(DomNode root) {
        ConversionPipeline.AnalyzedPage page = new ConversionPipeline().analyze(root, 60);
        return new GutenbergConverter().convert(page.hierarchy, page.typography, page.designTokens,
                ConversionOptions.defaults(PageBuilder.GUTENBERG));
    }

    @Test
    void syntheticWrappers_areSplicedAway() {
        ConverterOutput output = convert(element("div").child(
                element("h1").text("Welcome"),
                element("p").text("Hello there")));

        GutenbergExport export = assertInstanceOf(GutenbergExport.class, output.exportData);
        assertEquals(List.of("core/heading", "core/paragraph"),
                export.blocks.stream().map(block -> block.blockName).toList());
        assertEquals(1, export.blocks.get(0).attrs.get("level"));
        assertEquals("<h1 class=\"wp-block-heading\">Welcome</h1>", export.blocks.get(0).innerHTML);
        assertEquals(2, output.nativeWidgets);
        assertEquals(0, output.htmlFallbacks);
    }

    @Test
    void styledHeadingAndParagraph_convertWithoutFallbacks() {
        DomNode root = element("div").child(
                element("h1").style("font-size", "32px").text("Title"),
                element("p").text("Body"));

        ConversionResult result = new ConversionPipeline().convert(root,
                ConversionOptions.defaults(PageBuilder.GUTENBERG));

        GutenbergExport export = assertInstanceOf(GutenbergExport.class, result.exportData);
        assertEquals(List.of("core/heading", "core/paragraph"),
                export.blocks.stream().map(block -> block.blockName).toList());
        assertEquals(1, export.blocks.get(0).attrs.get("level"));
        assertTrue(result.fallbacks.isEmpty());
        result.hierarchy.forEach(GutenbergConverterTest::assertNoReview);
    }

    private static void assertNoReview(ComponentHierarchy node) {
        assertFalse(node.manualReviewNeeded, () -> node.id + " is flagged for review");
        node.children.forEach(GutenbergConverterTest::assertNoReview);
    }

    @Test
    void postContent_parsesBackToTheSameBlocks() {
        ConverterOutput output = convert(element("div").child(
                element("h2").text("Features"),
                element("p").text("Fast & simple")));

        GutenbergExport export = (GutenbergExport) output.exportData;
        List<GutenbergBlock> parsed = BlockParser.parse(export.postContent);

        assertEquals(export.blocks.size(), parsed.size());
        for (int i = 0; i < parsed.size(); i++) {
            assertEquals(export.blocks.get(i).blockName, parsed.get(i).blockName);
            assertEquals(export.blocks.get(i).innerHTML, parsed.get(i).innerHTML);
        }
        assertEquals(2, parsed.get(0).attrs.get("level"));
    }

    @Test
    void unknownMarkup_fallsBackToHtmlBlock() {
        ConverterOutput output = convert(element("div").child(element("marquee").text("Sale")));

        GutenbergExport export = (GutenbergExport) output.exportData;
        assertEquals("core/html", export.blocks.get(0).blockName);
        assertTrue(export.blocks.get(0).innerHTML.contains("<marquee>Sale</marquee>"));
        assertEquals(1, output.htmlFallbacks);
    }
}
