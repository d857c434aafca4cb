package org.dxworks.pageframe.converter.divi;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ShortcodeWriterTest {

    @Test
    void encode_escapesQuotesAndBrackets() {
        assertEquals("say %22hi%22 %91now%93", ShortcodeWriter.encode("say \"hi\" [now]"));
    }

    @Test
    void write_nestsChildrenAndSkipsEmptyAttributes() {
        Map<String, Object> textAttrs = new LinkedHashMap<>();
        textAttrs.put("admin_label", "Intro");
        textAttrs.put("text_orientation", "");
        textAttrs.put("custom_css_main_element", null);
        DiviElement text = DiviElement.module("et_pb_text", textAttrs, "<p>Hello</p>");
        DiviElement column = new DiviElement("et_pb_column", Map.of("type", "4_4"), List.of(text), null);
        DiviElement row = new DiviElement("et_pb_row", Map.of(), List.of(column), null);
        DiviElement section = new DiviElement("et_pb_section", Map.of("fb_built", "1"), List.of(row), null);

        assertEquals("[et_pb_section fb_built=\"1\"]\n"
                        + "[et_pb_row]\n"
                        + "[et_pb_column type=\"4_4\"]\n"
                        + "[et_pb_text admin_label=\"Intro\"]<p>Hello</p>[/et_pb_text]\n"
                        + "[/et_pb_column]\n"
                        + "[/et_pb_row]\n"
                        + "[/et_pb_section]",
                ShortcodeWriter.write(List.of(section)));
    }

    @Test
    void write_separatesTopLevelSections() {
        DiviElement first = DiviElement.module("et_pb_code", Map.of(), "<b>a</b>");
        DiviElement second = DiviElement.module("et_pb_code", Map.of(), "<b>b</b>");

        assertEquals("[et_pb_code]<b>a</b>[/et_pb_code]\n[et_pb_code]<b>b</b>[/et_pb_code]",
                ShortcodeWriter.write(List.of(first, second)));
    }
}
