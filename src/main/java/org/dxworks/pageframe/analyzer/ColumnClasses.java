package org.dxworks.pageframe.analyzer;

import org.dxworks.pageframe.model.AnalyzedElement;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grid-framework column class names: Bootstrap ({@code col}, {@code col-6},
 * {@code col-md-4}), Foundation ({@code medium-6}, {@code columns}), Tailwind
 * ({@code w-1/2}, {@code col-span-6}), {@code span-N} and Elementor
 * ({@code elementor-col-50}).
 */
public final class ColumnClasses {

    private static final Pattern TWELFTHS = Pattern.compile(
            "col-(?:(?:xs|sm|md|lg|xl|xxl)-)?(\\d{1,2})|(?:small|medium|large)-(\\d{1,2})|(?:.+-)?span-(\\d{1,2})");
    private static final Pattern FRACTION = Pattern.compile("(?:[a-z0-9]+:)?w-(\\d+)/(\\d+)");
    private static final Pattern PERCENT = Pattern.compile("elementor-col-(\\d{1,3})");
    private static final Pattern UNSIZED = Pattern.compile("col|col-(?:xs|sm|md|lg|xl|xxl)|columns?");

    private ColumnClasses() {
    }

    /**
     * Width in percent declared by the class, {@link Double#NaN} for a column
     * class without a width, or null when the class is no column class.
     */
    public static Double sizeOf(String className) {
        String cls = className.toLowerCase(Locale.ROOT);

        Matcher twelfths = TWELFTHS.matcher(cls);
        if (twelfths.matches()) {
            String n = twelfths.group(1) != null ? twelfths.group(1)
                    : twelfths.group(2) != null ? twelfths.group(2) : twelfths.group(3);
            int span = Integer.parseInt(n);
            return span >= 1 && span <= 12 ? span * 100.0 / 12.0 : null;
        }
        Matcher fraction = FRACTION.matcher(cls);
        if (fraction.matches()) {
            int denominator = Integer.parseInt(fraction.group(2));
            return denominator == 0 ? null : Integer.parseInt(fraction.group(1)) * 100.0 / denominator;
        }
        Matcher percent = PERCENT.matcher(cls);
        if (percent.matches()) {
            return Double.parseDouble(percent.group(1));
        }
        if (UNSIZED.matcher(cls).matches()) {
            return Double.NaN;
        }
        return null;
    }

    /**
     * First sized column class of the element, else NaN if it carries an
     * unsized one, else null.
     */
    public static Double sizeOf(AnalyzedElement element) {
        return sizeOf(element.classes);
    }

    public static Double sizeOf(List<String> classes) {
        Double unsized = null;
        for (String cls : classes) {
            Double size = sizeOf(cls);
            if (size != null && !size.isNaN()) {
                return size;
            }
            if (size != null) {
                unsized = size;
            }
        }
        return unsized;
    }

    public static boolean hasColumnClass(AnalyzedElement element) {
        return sizeOf(element) != null;
    }
}
