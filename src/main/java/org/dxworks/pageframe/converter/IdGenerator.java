package org.dxworks.pageframe.converter;

import java.util.Locale;

/**
 * Deterministic per-run id sequences in each builder's native id format.
 * A fresh generator yields the same sequence, so identical input produces
 * identical exports.
 */
public abstract class IdGenerator {
    private long counter;

    public final String next() {
        return format(++counter);
    }

    protected abstract String format(long n);

    /**
     * Elementor: 8 lowercase hex characters.
     */
    public static IdGenerator hex8() {
        return new IdGenerator() {
            @Override
            protected String format(long n) {
                long mixed = (n * 0x9E3779B1L) & 0xFFFFFFFFL;
                return String.format(Locale.ROOT, "%08x", mixed);
            }
        };
    }

    /**
     * Beaver Builder: 13 lowercase hex characters.
     */
    public static IdGenerator hex13() {
        return new IdGenerator() {
            @Override
            protected String format(long n) {
                long mixed = (n * 0x9E3779B97F4A7C15L) & 0xFFFFFFFFFFFFFL;
                return String.format(Locale.ROOT, "%013x", mixed);
            }
        };
    }

    /**
     * Bricks: 6 lowercase alphanumeric characters.
     */
    public static IdGenerator base36() {
        return new IdGenerator() {
            private static final long SPACE = 2_176_782_336L; // 36^6

            @Override
            protected String format(long n) {
                long mixed = Math.floorMod(n * 1_000_003L + 12_345L, SPACE);
                String id = Long.toString(mixed, 36);
                return "0".repeat(6 - id.length()) + id;
            }
        };
    }

    /**
     * Oxygen: positive integers starting at 1.
     */
    public static IdGenerator sequential() {
        return new IdGenerator() {
            @Override
            protected String format(long n) {
                return Long.toString(n);
            }
        };
    }

    /**
     * Identifiers for formats without native ids; never written to the export.
     */
    public static IdGenerator prefixed(String prefix) {
        return new IdGenerator() {
            @Override
            protected String format(long n) {
                return prefix + "-" + n;
            }
        };
    }
}
