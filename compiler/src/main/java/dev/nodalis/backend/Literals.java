package dev.nodalis.backend;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions of Structured Text literal lexemes into values the C-family
 * backends can print.
 */
public final class Literals {

    private static final Pattern DURATION_PART =
            Pattern.compile("(\\d+(?:\\.\\d+)?)(ms|us|ns|d|h|m|s)", Pattern.CASE_INSENSITIVE);

    private Literals() {
    }

    public static String decimal(String lexeme) {
        return lexeme.replace("_", "");
    }

    /**
     * {@code 16#FF}, {@code 8#17} or {@code 2#1010_0001} as a value.
     */
    public static long basedValue(String lexeme) {
        int hash = lexeme.indexOf('#');
        if (hash < 0) {
            return Long.parseLong(decimal(lexeme));
        }
        int radix = Integer.parseInt(lexeme.substring(0, hash));
        return Long.parseUnsignedLong(decimal(lexeme.substring(hash + 1)), radix);
    }

    public static String hex(long value) {
        return "0x" + Long.toHexString(value).toUpperCase(Locale.ROOT);
    }

    /**
     * A CASE label bound: optionally signed, decimal or based.
     */
    public static long integerValue(String lexeme) {
        String text = lexeme.trim();
        if (text.startsWith("-")) {
            return -integerValue(text.substring(1));
        }
        return text.indexOf('#') >= 0 ? basedValue(text) : Long.parseLong(decimal(text));
    }

    /**
     * Milliseconds of a duration such as {@code 1h2m3s}, {@code 1.5s} or
     * {@code -250ms}. The {@code T#}/{@code TIME#} prefix is optional.
     */
    public static long durationMillis(String lexeme) {
        String text = lexeme.trim();
        int hash = text.lastIndexOf('#');
        if (hash >= 0) {
            text = text.substring(hash + 1);
        }
        text = text.replace("_", "");
        boolean negative = text.startsWith("-");
        if (negative) {
            text = text.substring(1);
        }
        Matcher matcher = DURATION_PART.matcher(text);
        BigDecimal total = BigDecimal.ZERO;
        int consumed = 0;
        while (matcher.find()) {
            if (matcher.start() != consumed) {
                throw new IllegalArgumentException("malformed duration: " + lexeme);
            }
            consumed = matcher.end();
            BigDecimal amount = new BigDecimal(matcher.group(1));
            total = total.add(amount.multiply(unitMillis(matcher.group(2))));
        }
        if (consumed == 0 || consumed != text.length()) {
            throw new IllegalArgumentException("malformed duration: " + lexeme);
        }
        long millis = total.setScale(0, RoundingMode.HALF_UP).longValueExact();
        return negative ? -millis : millis;
    }

    private static BigDecimal unitMillis(String unit) {
        switch (unit.toLowerCase(Locale.ROOT)) {
            case "d":
                return BigDecimal.valueOf(86_400_000L);
            case "h":
                return BigDecimal.valueOf(3_600_000L);
            case "m":
                return BigDecimal.valueOf(60_000L);
            case "s":
                return BigDecimal.valueOf(1_000L);
            case "ms":
                return BigDecimal.ONE;
            case "us":
                return new BigDecimal("0.001");
            default:
                return new BigDecimal("0.000001");
        }
    }

    /**
     * Contents of a quoted string literal with {@code $} escapes resolved.
     */
    public static String unquote(String lexeme) {
        String body = lexeme.substring(1, lexeme.length() - 1);
        StringBuilder value = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c != '$' || i + 1 >= body.length()) {
                value.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (Character.toUpperCase(next)) {
                case 'L':
                case 'N':
                    value.append('\n');
                    break;
                case 'R':
                    value.append('\r');
                    break;
                case 'T':
                    value.append('\t');
                    break;
                case 'P':
                    value.append('\f');
                    break;
                default:
                    if (isHexDigit(next) && i + 1 < body.length() && isHexDigit(body.charAt(i + 1))) {
                        value.append((char) Integer.parseInt(body.substring(i, i + 2), 16));
                        i++;
                    } else {
                        value.append(next);
                    }
            }
        }
        return value.toString();
    }

    /**
     * A double-quoted literal valid in both C++ and JavaScript.
     */
    public static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    quoted.append("\\\"");
                    break;
                case '\\':
                    quoted.append("\\\\");
                    break;
                case '\n':
                    quoted.append("\\n");
                    break;
                case '\r':
                    quoted.append("\\r");
                    break;
                case '\t':
                    quoted.append("\\t");
                    break;
                case '\f':
                    quoted.append("\\f");
                    break;
                default:
                    quoted.append(c);
            }
        }
        return quoted.append('"').toString();
    }

    private static boolean isHexDigit(char c) {
        return Character.digit(c, 16) >= 0;
    }
}
