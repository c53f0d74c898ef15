package com.openworkout.owf.ast;

import com.openworkout.owf.units.DecimalParser;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Typed content of a {@code #} or {@code ##} heading line:
 * {@code name [type] (date) @RPE n @RIR n}. Every part except the name is optional.
 */
public final class Heading {
    private final SourceLocation location;
    private final String name;
    private final String modality;
    private final WorkoutDate date;
    private final BigDecimal rpe;
    private final Integer rir;

    public Heading(
            SourceLocation location,
            String name,
            String modality,
            WorkoutDate date,
            BigDecimal rpe,
            Integer rir) {
        this.location = location;
        this.name = Objects.requireNonNull(name, "name");
        this.modality = modality;
        this.date = date;
        this.rpe = rpe == null ? null : DecimalParser.normalize(rpe);
        this.rir = rir;
    }

    public static Heading anonymous(SourceLocation location) {
        return new Heading(location, "", null, null, null, null);
    }

    public SourceLocation getLocation() {
        return location;
    }

    /** Free-text name; empty for the implicit workout before the first heading. */
    public String getName() {
        return name;
    }

    /** Declared modality tag such as {@code run} or {@code strength}; {@code null} when absent. */
    public String getModality() {
        return modality;
    }

    public WorkoutDate getDate() {
        return date;
    }

    /** Default RPE for the block, or {@code null}. */
    public BigDecimal getRpe() {
        return rpe;
    }

    public Integer getRir() {
        return rir;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Heading)) {
            return false;
        }
        Heading other = (Heading) obj;
        return name.equals(other.name)
                && Objects.equals(modality, other.modality)
                && Objects.equals(date, other.date)
                && (rpe == null ? other.rpe == null : other.rpe != null && rpe.compareTo(other.rpe) == 0)
                && Objects.equals(rir, other.rir);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, modality, date, rpe, rir);
    }

    @Override
    public String toString() {
        return name;
    }
}
