package com.threatintel.riskengine.domain.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Typed identifying value carried by a record. Equality is exact on (type, value);
 * collectors are expected to normalise values before they reach the engine.
 */
public record Pivot(PivotType type, String value) implements Comparable<Pivot> {

    private static final Comparator<Pivot> ORDER = Comparator
            .comparing(Pivot::type)
            .thenComparing(Pivot::value);

    public Pivot {
        Objects.requireNonNull(type, "pivot type");
        Objects.requireNonNull(value, "pivot value");
    }

    public static Pivot of(PivotType type, String value) {
        return new Pivot(type, value);
    }

    /** Literal form shown to analysts, e.g. {@code user_id:emp-7415}. */
    public String literal() {
        return type.code() + ":" + value;
    }

    @Override
    public int compareTo(Pivot other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return literal();
    }
}
