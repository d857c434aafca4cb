package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.BoxSpacing;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

class DimensionParserTest {

    @Test
    void toPixels_convertsRelativeUnits() {
        assertEquals(24.0, DimensionParser.toPixels("24px").getAsDouble());
        assertEquals(32.0, DimensionParser.toPixels("2rem").getAsDouble());
        assertEquals(16.0, DimensionParser.toPixels("12pt").getAsDouble());
        assertEquals(192.0, DimensionParser.toPixels("10vw").getAsDouble());
        assertEquals(10.0, DimensionParser.toPixels("10").getAsDouble());
    }

    @Test
    void toPixels_keywordsAndPercentages_areEmpty() {
        assertFalse(DimensionParser.toPixels("auto").isPresent());
        assertFalse(DimensionParser.toPixels("50%").isPresent());
        assertFalse(DimensionParser.toPixels(null).isPresent());
    }

    @Test
    void percent_onlyForPercentages() {
        assertEquals(33.33, DimensionParser.percent("33.33%").getAsDouble());
        assertFalse(DimensionParser.percent("300px").isPresent());
    }

    @Test
    void parseBox_expandsShorthand() {
        BoxSpacing two = DimensionParser.parseBox("10px 20px");
        assertEquals("10px", two.top);
        assertEquals("20px", two.right);
        assertEquals("10px", two.bottom);
        assertEquals("20px", two.left);

        BoxSpacing three = DimensionParser.parseBox("1px 2px 3px");
        assertEquals("2px", three.left);
        assertNull(DimensionParser.parseBox("1px 2px 3px 4px 5px"));
    }

    @Test
    void formatPixels_dropsTrailingZero() {
        assertEquals("16px", DimensionParser.formatPixels(16.0));
        assertEquals("15.5px", DimensionParser.formatPixels(15.5));
    }
}
