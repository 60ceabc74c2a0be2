package com.jsast.spanned;

import com.jsast.spanned.SourceLocation.Position;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SourceLocationTest {

    @Test
    void positionsOrderByLineThenColumn() {
        assertTrue(new Position(1, 10).compareTo(new Position(2, 0)) < 0);
        assertTrue(new Position(2, 3).compareTo(new Position(2, 1)) > 0);
        assertEquals(0, new Position(4, 4).compareTo(new Position(4, 4)));
    }

    @Test
    void positionArithmeticWorksOnRawDeltas() {
        Position p = new Position(3, 5);
        assertEquals(new Position(3, 9), p.plusColumns(4));
        assertEquals(new Position(4, 7), p.plus(new Position(1, 2)));
        assertEquals(new Position(2, 4), p.minus(new Position(1, 1)));
    }

    @Test
    void locationsOrderByStartThenEnd() {
        SourceLocation a = new SourceLocation(1, 0, 1, 5);
        SourceLocation b = new SourceLocation(1, 0, 1, 2);
        SourceLocation c = new SourceLocation(0, 9, 3, 0);
        List<SourceLocation> locations = new ArrayList<>(List.of(a, b, c));
        Collections.sort(locations);
        assertEquals(List.of(c, b, a), locations);
    }

    @Test
    void startAfterEndIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new SourceLocation(2, 0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new SourceLocation(1, 5, 1, 4));
        assertThrows(IllegalArgumentException.class, () -> new SourceLocation(null, new Position(1, 1)));
    }

    @Test
    void emptyRangeIsAllowed() {
        SourceLocation empty = new SourceLocation(3, 3, 3, 3);
        assertEquals(empty.start(), empty.end());
    }

    @Test
    void spanRunsFromFirstStartToLastEnd() {
        SourceLocation first = new SourceLocation(1, 2, 1, 4);
        SourceLocation last = new SourceLocation(3, 0, 3, 8);
        assertEquals(new SourceLocation(1, 2, 3, 8), SourceLocation.span(first, last));
    }

    @Test
    void zeroSentinel() {
        assertTrue(SourceLocation.zero().isZero());
        assertTrue(new SourceLocation(0, 0, 0, 0).isZero());
        assertFalse(new SourceLocation(0, 0, 0, 1).isZero());
    }

    @Test
    void containment() {
        SourceLocation outer = new SourceLocation(1, 0, 2, 0);
        assertTrue(outer.contains(new SourceLocation(1, 4, 1, 9)));
        assertTrue(outer.contains(outer));
        assertFalse(outer.contains(new SourceLocation(1, 4, 2, 1)));
    }

    @Test
    void readableToString() {
        assertEquals("1:2-3:4", new SourceLocation(1, 2, 3, 4).toString());
    }
}
