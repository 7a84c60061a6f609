package work.lcod.summation.attributes;

import java.util.Locale;

/**
 * How a column value is rendered in folder paths.
 */
public enum ValueFormat {
    /** {@code _<value>}. */
    PLAIN,
    /** Positive values carry an explicit sign: {@code _+<value>}. */
    SIGNED,
    /** Quadrant codes: 11 {@code _mI}, 12 {@code _mO}, 21 {@code _pI}, 22 {@code _pO}. */
    QUADRANT;

    public static ValueFormat from(String value) {
        if (value == null || value.isBlank()) {
            return PLAIN;
        }
        try {
            return ValueFormat.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported value format: " + value);
        }
    }
}
