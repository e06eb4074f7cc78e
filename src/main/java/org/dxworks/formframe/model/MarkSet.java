package org.dxworks.formframe.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable set of marks holding at most one mark per {@link MarkType}.
 * {@link #with(Mark)} returns a new set where the added mark replaces any mark of the same kind,
 * so adding marks from the outermost element inwards leaves the innermost value in place.
 */
public final class MarkSet {
    public static final MarkSet EMPTY = new MarkSet(new EnumMap<>(MarkType.class));

    private final Map<MarkType, Mark> marks;

    private MarkSet(EnumMap<MarkType, Mark> marks) {
        this.marks = Collections.unmodifiableMap(marks);
    }

    public static MarkSet of(Collection<Mark> marks) {
        MarkSet result = EMPTY;
        if (marks != null) {
            for (Mark mark : marks) {
                result = result.with(mark);
            }
        }
        return result;
    }

    public static MarkSet of(Mark... marks) {
        return of(List.of(marks));
    }

    public MarkSet with(Mark mark) {
        if (mark.equals(marks.get(mark.getType()))) {
            return this;
        }
        EnumMap<MarkType, Mark> copy = copy();
        copy.put(mark.getType(), mark);
        return new MarkSet(copy);
    }

    public MarkSet withAll(MarkSet other) {
        MarkSet result = this;
        for (Mark mark : other.marks.values()) {
            result = result.with(mark);
        }
        return result;
    }

    public MarkSet without(MarkType type) {
        if (!marks.containsKey(type)) {
            return this;
        }
        EnumMap<MarkType, Mark> copy = copy();
        copy.remove(type);
        return new MarkSet(copy);
    }

    public boolean contains(MarkType type) {
        return marks.containsKey(type);
    }

    public Mark get(MarkType type) {
        return marks.get(type);
    }

    public boolean isEmpty() {
        return marks.isEmpty();
    }

    /** Marks in canonical order. */
    public List<Mark> asList() {
        return Collections.unmodifiableList(new ArrayList<>(marks.values()));
    }

    private EnumMap<MarkType, Mark> copy() {
        EnumMap<MarkType, Mark> copy = new EnumMap<>(MarkType.class);
        copy.putAll(marks);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MarkSet)) return false;
        return marks.equals(((MarkSet) o).marks);
    }

    @Override
    public int hashCode() {
        return marks.hashCode();
    }

    @Override
    public String toString() {
        return marks.values().toString();
    }
}
