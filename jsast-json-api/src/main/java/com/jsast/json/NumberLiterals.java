package com.jsast.json;

import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * Computes the numeric value of a JavaScript numeric literal from its raw source text.
 *
 * <p>The checks run in a fixed order: {@code "0"}, hex, octal and binary prefixes,
 * legacy octal ({@code 0} followed only by octal digits), then decimal with a fraction or
 * exponent, then plain decimal. Float markers must be tested after legacy octal, or
 * {@code "0.5"} would be read as octal.</p>
 *
 * <p>Results within the 32-bit signed range are {@link Integer}s; everything else is a
 * {@link Double}. Text that does not parse yields {@link Double#NaN} rather than an error.</p>
 */
public final class NumberLiterals {

    private static final Pattern DECIMAL = Pattern.compile("(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");

    private static final Double NAN = Double.NaN;

    private NumberLiterals() {
    }

    public static Number valueOf(CharSequence raw) {
        String text = raw.toString();
        if (text.equals("0")) {
            return 0;
        }
        if (hasRadixPrefix(text, 'x')) {
            return integer(text.substring(2), 16);
        }
        if (hasRadixPrefix(text, 'o')) {
            return integer(text.substring(2), 8);
        }
        if (hasRadixPrefix(text, 'b')) {
            return integer(text.substring(2), 2);
        }
        if (isLegacyOctal(text)) {
            return integer(text.substring(1), 8);
        }
        if (text.indexOf('e') >= 0 || text.indexOf('E') >= 0 || text.indexOf('.') >= 0) {
            return decimal(text);
        }
        return integer(text, 10);
    }

    private static boolean hasRadixPrefix(String text, char marker) {
        return text.length() >= 2
            && text.charAt(0) == '0'
            && Character.toLowerCase(text.charAt(1)) == marker;
    }

    private static boolean isLegacyOctal(String text) {
        if (text.length() < 2 || text.charAt(0) != '0') {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '7') {
                return false;
            }
        }
        return true;
    }

    private static Number integer(String digits, int radix) {
        if (digits.isEmpty() || digits.charAt(0) == '+' || digits.charAt(0) == '-') {
            return NAN;
        }
        BigInteger value;
        try {
            value = new BigInteger(digits, radix);
        } catch (NumberFormatException e) {
            return NAN;
        }
        if (value.bitLength() < Integer.SIZE) {
            return value.intValue();
        }
        return value.doubleValue();
    }

    private static Number decimal(String text) {
        if (!DECIMAL.matcher(text).matches()) {
            return NAN;
        }
        return Double.parseDouble(text);
    }
}
