package com.openworkout.owf.ast;

/** Repetition target of a strength step: a positive count or {@code max}. */
public final class Reps {
    private static final Reps MAX = new Reps(0);

    private final int count;

    private Reps(int count) {
        this.count = count;
    }

    public static Reps of(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("Reps must be positive: " + count);
        }
        return new Reps(count);
    }

    public static Reps max() {
        return MAX;
    }

    public boolean isMax() {
        return this == MAX;
    }

    public int getCount() {
        if (isMax()) {
            throw new IllegalStateException("max reps has no count");
        }
        return count;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Reps)) {
            return false;
        }
        Reps other = (Reps) obj;
        return !isMax() && !other.isMax() && count == other.count;
    }

    @Override
    public int hashCode() {
        return isMax() ? -1 : count;
    }

    @Override
    public String toString() {
        return isMax() ? "max" : Integer.toString(count);
    }
}
