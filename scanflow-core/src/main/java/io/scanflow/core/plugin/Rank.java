package io.scanflow.core.plugin;

/// Declared dimensionality of a plugin input or output.
///
/// Either a fixed non-negative rank, {@link #ANY} for plugins that accept or produce data of
/// arbitrary rank, or {@link #NONE} for plugins that produce no data.
public final class Rank {

    /// Matches every rank.
    public static final Rank ANY = new Rank(-1);

    /// No data at all.
    public static final Rank NONE = new Rank(-2);

    private static final Rank[] FIXED = {new Rank(0), new Rank(1), new Rank(2), new Rank(3)};

    private final int value;

    private Rank(int value) {
        this.value = value;
    }

    /// Returns the rank for a fixed number of dimensions.
    ///
    /// @param value number of dimensions, not negative
    /// @return rank instance, never null
    public static Rank of(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("Rank must not be negative: " + value);
        }
        return value < FIXED.length ? FIXED[value] : new Rank(value);
    }

    public boolean isAny() {
        return value == ANY.value;
    }

    public boolean isNone() {
        return value == NONE.value;
    }

    /// Returns the fixed number of dimensions.
    ///
    /// @return rank value
    /// @throws IllegalStateException if this is {@link #ANY} or {@link #NONE}
    public int getValue() {
        if (value < 0) {
            throw new IllegalStateException("Rank " + this + " has no fixed value");
        }
        return value;
    }

    /// Checks whether data of rank `other` fits this rank.
    ///
    /// {@link #ANY} on either side always fits. {@link #NONE} fits nothing else.
    ///
    /// @param other rank to compare with, not null
    /// @return true if compatible
    public boolean accepts(Rank other) {
        if (isAny() || other.isAny()) {
            return true;
        }
        return value == other.value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Rank other)) return false;
        return value == other.value;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(value);
    }

    @Override
    public String toString() {
        if (isAny()) return "ANY";
        if (isNone()) return "NONE";
        return Integer.toString(value);
    }
}
