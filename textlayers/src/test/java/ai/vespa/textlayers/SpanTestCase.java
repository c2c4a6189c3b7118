// Copyright Vespa.ai. Licensed under the terms of the Apache 2.0 license. See LICENSE in the project root.
package ai.vespa.textlayers;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpanTestCase {

    @Test
    void requireThatInvalidRangesAreRejected() {
        assertThrows(InvalidRangeException.class, () -> Span.of(3, 3));
        assertThrows(InvalidRangeException.class, () -> Span.of(4, 3));
        assertThrows(InvalidRangeException.class, () -> Span.of(-1, 3));
    }

    @Test
    void requireThatSpansAreOrderedByStartThenEnd() {
        assertTrue(Span.of(1, 4).compareTo(Span.of(2, 3)) < 0);
        assertTrue(Span.of(1, 4).compareTo(Span.of(1, 5)) < 0);
        assertEquals(0, Span.of(1, 4).compareTo(Span.of(1, 4)));
        assertEquals(Span.of(1, 4), Span.of(1, 4));
        assertNotEquals(Span.of(1, 4), Span.of(1, 5));
        assertEquals("[1, 4)", Span.of(1, 4).toString());
    }

    @Test
    void requireThatOverlapAndCoverAreHalfOpen() {
        assertTrue(Span.of(1, 4).overlaps(Span.of(3, 6)));
        assertFalse(Span.of(1, 3).overlaps(Span.of(3, 6)));
        assertTrue(Span.of(1, 8).covers(Span.of(2, 4)));
        assertTrue(Span.of(1, 8).covers(Span.of(1, 8)));
        assertFalse(Span.of(2, 8).covers(Span.of(1, 4)));
    }

    @Test
    void requireThatEnvelopingSpanExtendsFromFirstToLastChild() {
        EnvelopingSpan span = EnvelopingSpan.of(List.of(Span.of(0, 5), Span.of(6, 9), Span.of(10, 15)));
        assertEquals(0, span.start());
        assertEquals(15, span.end());
        assertTrue(span.isEnveloping());
        assertEquals(3, span.children().size());
        assertEquals(Span.of(0, 15), span);
        assertEquals(List.of("Hello", "big", "world"), span.texts("Hello big world"));
        assertEquals(List.of("Hello"), Span.of(0, 5).texts("Hello big world"));
    }

    @Test
    void requireThatEnvelopingSpanChildrenMustBeOrderedAndNonOverlapping() {
        assertThrows(NonContiguousChildrenException.class, () -> EnvelopingSpan.of(List.of()));
        assertThrows(NonContiguousChildrenException.class, () -> EnvelopingSpan.of(List.of(Span.of(6, 9), Span.of(0, 5))));
        assertThrows(NonContiguousChildrenException.class, () -> EnvelopingSpan.of(List.of(Span.of(0, 5), Span.of(4, 9))));
        EnvelopingSpan.of(List.of(Span.of(0, 5), Span.of(5, 9))); // adjacent is fine
    }

}
