package org.dxworks.pageframe.hierarchy;

import org.dxworks.pageframe.analyzer.ColumnClasses;
import org.dxworks.pageframe.analyzer.DimensionParser;
import org.dxworks.pageframe.model.AnalyzedElement;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides whether the children of a layout element form a row of columns.
 */
public class ColumnDetector {

    static final double SUM_TOLERANCE = 2.0;

    private static final Pattern REPEAT = Pattern.compile("repeat\\(\\s*(\\d+)\\s*,");

    public enum Kind {
        /** Every child carries a column signal and each row of sizes adds up to 100%. */
        COLUMNS,
        /** No child carries a column signal. */
        SINGLE,
        /** Partial signals or sizes that do not add up. */
        AMBIGUOUS
    }

    public static class Partition {
        public final Kind kind;
        public final List<Double> sizes; // percent per child, COLUMNS only
        public final String reason;
        public final List<Integer> rowLengths; // children per visual row, COLUMNS only

        Partition(Kind kind, List<Double> sizes, String reason, List<Integer> rowLengths) {
            this.kind = kind;
            this.sizes = List.copyOf(sizes);
            this.reason = reason;
            this.rowLengths = List.copyOf(rowLengths);
        }

        static Partition single() {
            return new Partition(Kind.SINGLE, List.of(), null, List.of());
        }

        static Partition ambiguous(String reason) {
            return new Partition(Kind.AMBIGUOUS, List.of(), reason, List.of());
        }
    }

    /**
     * Splits the children into rows of columns. Columns whose sizes overflow
     * 100% wrap onto a new row, the way grids and bootstrap rows wrap; every
     * row must fill 100% except the last row of a grid.
     */
    public Partition partition(AnalyzedElement parent, List<AnalyzedElement> children) {
        if (children.isEmpty()) {
            return Partition.single();
        }

        int tracks = gridTrackCount(parent);
        List<Double> signals = new ArrayList<>();
        int signalled = 0;
        for (AnalyzedElement child : children) {
            Double signal = signalOf(child, tracks);
            signals.add(signal);
            if (signal != null) {
                signalled++;
            }
        }

        if (signalled == 0) {
            return Partition.single();
        }
        if (signalled < children.size()) {
            return Partition.ambiguous(signalled + " of " + children.size()
                    + " children carry column signals");
        }

        double sized = 0;
        int unsized = 0;
        for (Double signal : signals) {
            if (signal.isNaN()) {
                unsized++;
            } else {
                sized += signal;
            }
        }
        double share = 0;
        if (unsized > 0) {
            if (sized >= 100.0 - SUM_TOLERANCE) {
                return Partition.ambiguous("sized columns leave no room for " + unsized + " unsized columns");
            }
            share = (100.0 - sized) / unsized;
        }

        List<Double> normalized = new ArrayList<>();
        List<Integer> rowLengths = new ArrayList<>();
        List<Double> row = new ArrayList<>();
        double rowSum = 0;
        for (Double signal : signals) {
            double size = signal.isNaN() ? share : signal;
            if (rowSum + size > 100.0 + SUM_TOLERANCE && !row.isEmpty()) {
                if (Math.abs(rowSum - 100.0) > SUM_TOLERANCE) {
                    return Partition.ambiguous("column sizes sum to " + round(rowSum + size) + "%");
                }
                closeRow(row, rowSum, normalized, rowLengths);
                row = new ArrayList<>();
                rowSum = 0;
            }
            row.add(size);
            rowSum += size;
        }
        if (Math.abs(rowSum - 100.0) <= SUM_TOLERANCE) {
            closeRow(row, rowSum, normalized, rowLengths);
        } else if (tracks > 1 && !rowLengths.isEmpty()) {
            // trailing grid row keeps the track width
            closeRow(row, 100.0, normalized, rowLengths);
        } else {
            return Partition.ambiguous("column sizes sum to " + round(rowSum) + "%");
        }
        return new Partition(Kind.COLUMNS, normalized, null, rowLengths);
    }

    private static void closeRow(List<Double> row, double rowSum, List<Double> normalized, List<Integer> rowLengths) {
        for (Double size : row) {
            normalized.add(round(size * 100.0 / rowSum));
        }
        rowLengths.add(row.size());
    }

    /**
     * Percent width signalled by the child, NaN for a column without a width,
     * null for no signal.
     */
    static Double signalOf(AnalyzedElement child, int parentTracks) {
        Double classSize = ColumnClasses.sizeOf(child);
        if (classSize != null) {
            return classSize;
        }
        OptionalDouble percent = DimensionParser.percent(child.styles.width());
        if (percent.isPresent() && percent.getAsDouble() > 0 && percent.getAsDouble() < 100) {
            return percent.getAsDouble();
        }
        if (parentTracks > 1) {
            return 100.0 / parentTracks;
        }
        return null;
    }

    /**
     * Track count of a grid container's {@code grid-template-columns}, 0 when
     * the element is no grid.
     */
    static int gridTrackCount(AnalyzedElement parent) {
        if (parent == null || !parent.styles.is("display", "grid")) {
            return 0;
        }
        String template = parent.styles.get("gridTemplateColumns");
        if (template == null || template.isBlank() || template.equals("none")) {
            return 0;
        }
        Matcher repeat = REPEAT.matcher(template);
        if (repeat.find()) {
            return Integer.parseInt(repeat.group(1));
        }
        int tracks = 0;
        int depth = 0;
        boolean inToken = false;
        for (char c : template.trim().toCharArray()) {
            if (c == '(') depth++;
            if (c == ')') depth--;
            if (Character.isWhitespace(c) && depth == 0) {
                inToken = false;
            } else if (!inToken) {
                inToken = true;
                if (c != '[') {
                    tracks++;
                }
            }
        }
        return tracks;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
