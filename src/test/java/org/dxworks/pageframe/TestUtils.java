package org.dxworks.pageframe;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.dxworks.pageframe.converter.ConverterOutput;
import org.dxworks.pageframe.converter.TargetConverter;
import org.dxworks.pageframe.dom.DomNode;
import org.dxworks.pageframe.model.ConversionOptions;

import static org.dxworks.pageframe.dom.DomNode.element;

public class TestUtils {
    public static final ObjectMapper APPROVAL_MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    /**
     * A small landing page: hero, two-column feature row, an unrecognizable
     * marquee and a contact form.
     */
    public static DomNode landingPage() {
        return element("body").child(
                element("section").attr("class", "hero").style("background-color", "#1a73e8").child(
                        element("h1").text("Build faster").style("font-size", "40px").style("color", "#ffffff"),
                        element("p").text("Pages that convert.").style("font-size", "16px"),
                        element("a").attr("class", "btn btn-primary").attr("href", "/signup").text("Get started")),
                element("div").attr("class", "row").child(
                        element("div").attr("class", "col-md-6").child(
                                element("h2").text("Fast").style("font-size", "25px"),
                                element("p").text("Renders in milliseconds.").style("font-size", "16px")),
                        element("div").attr("class", "col-md-6").child(
                                element("h2").text("Flexible").style("font-size", "25px"),
                                element("img").attr("src", "https://cdn.example.com/flex.png").attr("alt", "Flexible"))),
                element("marquee").text("Limited offer"),
                element("form").attr("action", "/contact").child(
                        element("input").attr("type", "email").attr("name", "email"),
                        element("button").attr("type", "submit").text("Send")));
    }

    /**
     * One row: a one-third column with a heading, a two-thirds column with a
     * paragraph.
     */
    public static DomNode twoColumnPage() {
        return element("div").child(
                element("div").attr("class", "col-md-4").child(element("h2").text("Left")),
                element("div").attr("class", "col-md-8").child(element("p").text("Right")));
    }

    public static ConverterOutput convert(TargetConverter converter, DomNode root) {
        ConversionPipeline.AnalyzedPage page = new ConversionPipeline().analyze(root, ConversionOptions.DEFAULT_MIN_CONFIDENCE);
        return converter.convert(page.hierarchy, page.typography, page.designTokens,
                ConversionOptions.defaults(converter.builder()));
    }
}
