// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import java.util.List;

/**
 * An immutable half-open interval [start, end) of a text. Spans are ordered and compared by (start, end) only:
 * two spans with the same boundaries are equal regardless of their kind or children.
 *
 * @see ElementarySpan
 * @see EnvelopingSpan
 */
public abstract class Span implements Comparable<Span> {

    private final int start;
    private final int end;

    Span(int start, int end) {
        if (start < 0 || end < 0)
            throw new InvalidRangeException("Span boundaries must be non-negative, got [" + start + ", " + end + ")");
        if (start >= end)
            throw new InvalidRangeException("Span start must be before its end, got [" + start + ", " + end + ")");
        this.start = start;
        this.end = end;
    }

    /** Creates an elementary span */
    public static ElementarySpan of(int start, int end) {
        return new ElementarySpan(start, end);
    }

    public int start() { return start; }

    public int end() { return end; }

    public int length() { return end - start; }

    /** Returns whether this and the given span share at least one position */
    public boolean overlaps(Span other) {
        return start < other.end && other.start < end;
    }

    /** Returns whether every position of the given span is also a position of this */
    public boolean covers(Span other) {
        return start <= other.start && other.end <= end;
    }

    public abstract boolean isEnveloping();

    /** Returns the spans this envelops, in order, or an empty list if this is elementary */
    public abstract List<Span> children();

    /** Returns the texts of this: one string for an elementary span, one per child for an enveloping span */
    abstract List<String> texts(String text);

    @Override
    public int compareTo(Span other) {
        int result = Integer.compare(start, other.start);
        return result != 0 ? result : Integer.compare(end, other.end);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) return true;
        if ( ! (o instanceof Span other)) return false;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }

}
