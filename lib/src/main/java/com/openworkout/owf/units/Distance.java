package com.openworkout.owf.units;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class Distance {

    private static final Pattern PATTERN =
            Pattern.compile("(\\d+(?:\\.\\d+)?)(m|km|mi|mile|miles|yd|ft)", Pattern.CASE_INSENSITIVE);

    private final BigDecimal value;
    private final String unit;

    public Distance(BigDecimal value, String unit) {
        this.value = DecimalParser.normalize(Objects.requireNonNull(value, "value"));
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    /** Returns the parsed distance, or {@code null} when {@code text} is not a distance. */
    public static Distance tryParse(String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            return null;
        }
        String unit = matcher.group(2).toLowerCase(Locale.ROOT);
        if ("miles".equals(unit)) {
            unit = "mile";
        }
        return new Distance(DecimalParser.parse(matcher.group(1)), unit);
    }

    public BigDecimal getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Distance)) {
            return false;
        }
        Distance other = (Distance) obj;
        return value.compareTo(other.value) == 0 && unit.equals(other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return DecimalParser.format(value) + unit;
    }
}
