package com.openworkout.owf.units;

import java.math.BigDecimal;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.text.ParsePosition;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Locale-neutral parser for the unsigned decimal numbers used throughout workout text
 * ({@code 80}, {@code 2.5}). Grouping separators, signs, exponents and comma decimals are rejected
 * so that a token such as {@code 1,5} never silently turns into a different value.
 */
public final class DecimalParser {

    private static final Pattern UNSIGNED_DECIMAL = Pattern.compile("\\d+(?:\\.\\d+)?");
    private static final ThreadLocal<DecimalFormat> DOT_FORMAT =
            ThreadLocal.withInitial(DecimalParser::buildFormat);

    private DecimalParser() {}

    /**
     * Parses an unsigned decimal. Returns {@code null} for null/blank input and throws
     * {@link NumberFormatException} for anything that is not a plain {@code digits[.digits]} token.
     */
    public static BigDecimal parse(String text) {
        if (text == null) {
            return null;
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (!UNSIGNED_DECIMAL.matcher(trimmed).matches()) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
        ParsePosition position = new ParsePosition(0);
        Number parsed = DOT_FORMAT.get().parse(trimmed, position);
        if (parsed == null || position.getIndex() != trimmed.length()) {
            throw new NumberFormatException("Invalid decimal: " + text);
        }
        if (!(parsed instanceof BigDecimal)) {
            return new BigDecimal(parsed.toString());
        }
        return (BigDecimal) parsed;
    }

    public static boolean isDecimal(String text) {
        return text != null && UNSIGNED_DECIMAL.matcher(text).matches();
    }

    /** Canonical text form: no exponent, no trailing fractional zeros. */
    public static String format(BigDecimal value) {
        return normalize(value).toPlainString();
    }

    public static BigDecimal normalize(BigDecimal value) {
        if (value.signum() == 0) {
            return BigDecimal.ZERO;
        }
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static DecimalFormat buildFormat() {
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(Locale.ROOT);
        symbols.setDecimalSeparator('.');
        DecimalFormat format = new DecimalFormat();
        format.setDecimalFormatSymbols(symbols);
        format.setParseBigDecimal(true);
        format.setGroupingUsed(false);
        format.setMaximumFractionDigits(Integer.MAX_VALUE);
        format.setMaximumIntegerDigits(Integer.MAX_VALUE);
        return format;
    }
}
