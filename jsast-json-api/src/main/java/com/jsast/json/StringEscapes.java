package com.jsast.json;

/**
 * Decodes backslash escapes in the source text of string literals and template quasis.
 *
 * <p>Supports the single character escapes, two-digit hex escapes, four-digit and braced
 * unicode escapes, legacy octal escapes and line continuations; any other escaped
 * character stands for itself. Text containing a malformed escape is returned as written.</p>
 */
public final class StringEscapes {

    private StringEscapes() {
    }

    /**
     * The value a literal with the given source text denotes.
     */
    public static String cook(CharSequence raw) {
        String text = raw.toString();
        if (text.indexOf('\\') < 0) {
            return text;
        }
        String decoded = decode(text);
        return decoded == null ? text : decoded;
    }

    /**
     * Returns null when an escape is malformed.
     */
    private static String decode(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int n = text.length();
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c != '\\') {
                out.append(c);
                i++;
                continue;
            }
            if (i + 1 >= n) {
                return null;
            }
            char escape = text.charAt(i + 1);
            i += 2;
            switch (escape) {
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'b' -> out.append('\b');
                case 'f' -> out.append('\f');
                case 'v' -> out.append('\u000B');
                case 'x' -> {
                    int value = hex(text, i, 2);
                    if (value < 0) {
                        return null;
                    }
                    out.append((char) value);
                    i += 2;
                }
                case 'u' -> {
                    if (i < n && text.charAt(i) == '{') {
                        int close = text.indexOf('}', i);
                        int value = close < 0 || close - i - 1 > 6 ? -1 : hex(text, i + 1, close - i - 1);
                        if (value < 0 || value > Character.MAX_CODE_POINT) {
                            return null;
                        }
                        out.appendCodePoint(value);
                        i = close + 1;
                    } else {
                        int value = hex(text, i, 4);
                        if (value < 0) {
                            return null;
                        }
                        out.append((char) value);
                        i += 4;
                    }
                }
                case '\r' -> {
                    if (i < n && text.charAt(i) == '\n') {
                        i++;
                    }
                }
                case '\n', '\u2028', '\u2029' -> {
                    // line continuation
                }
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    int value = escape - '0';
                    int maxDigits = escape <= '3' ? 2 : 1;
                    while (maxDigits > 0 && i < n && isOctalDigit(text.charAt(i))) {
                        value = value * 8 + (text.charAt(i) - '0');
                        i++;
                        maxDigits--;
                    }
                    out.append((char) value);
                }
                default -> out.append(escape);
            }
        }
        return out.toString();
    }

    /**
     * Parses exactly {@code length} hex digits at {@code from}, or returns -1.
     */
    private static int hex(String text, int from, int length) {
        if (length <= 0 || from + length > text.length()) {
            return -1;
        }
        int value = 0;
        for (int i = from; i < from + length; i++) {
            int digit = Character.digit(text.charAt(i), 16);
            if (digit < 0) {
                return -1;
            }
            value = value * 16 + digit;
        }
        return value;
    }

    private static boolean isOctalDigit(char c) {
        return c >= '0' && c <= '7';
    }
}
