package com.pivotdeck.pivot;

import java.util.List;
import java.util.Objects;

/**
 * The bucket labels of one record along one pivot axis, one label per axis dimension.
 *
 * <p>An axis without dimensions has the single tuple {@link #EMPTY}, displayed as
 * {@code All}. Multi-dimension tuples display as labels joined by {@code " / "}.
 */
public record LabelTuple(List<String> labels) {

    public static final LabelTuple EMPTY = new LabelTuple(List.of());

    /** Display name of {@link #EMPTY}. */
    public static final String ALL = "All";

    public LabelTuple {
        Objects.requireNonNull(labels, "labels must not be null");
        labels = List.copyOf(labels);
    }

    public static LabelTuple of(String... labels) {
        return new LabelTuple(List.of(labels));
    }

    public int size() {
        return labels.size();
    }

    public String get(int index) {
        return labels.get(index);
    }

    /**
     * Returns the display name used as a key when serializing.
     *
     * @return the joined labels, or {@code All} for the empty tuple
     */
    public String displayName() {
        return labels.isEmpty() ? ALL : String.join(" / ", labels);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
