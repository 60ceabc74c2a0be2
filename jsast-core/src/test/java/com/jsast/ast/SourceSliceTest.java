package com.jsast.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SourceSliceTest {

    private static final String SOURCE = "let answer = 42;";

    @Test
    void viewsPartOfTheSource() {
        SourceSlice slice = SourceSlice.of(SOURCE, 4, 10);
        assertEquals(6, slice.length());
        assertEquals('a', slice.charAt(0));
        assertEquals("answer", slice.toString());
        assertEquals("swe", slice.subSequence(2, 5).toString());
    }

    @Test
    void equalityIsByContent() {
        SourceSlice first = SourceSlice.of(SOURCE, 13, 15);
        SourceSlice second = SourceSlice.of("x = 42", 4, 6);
        assertEquals(first, second);
        assertEquals(first.hashCode(), second.hashCode());
        assertNotEquals(first, SourceSlice.of(SOURCE, 4, 10));
    }

    @Test
    void boundsAreChecked() {
        assertThrows(IndexOutOfBoundsException.class, () -> SourceSlice.of(SOURCE, 10, 4));
        assertThrows(IndexOutOfBoundsException.class, () -> SourceSlice.of(SOURCE, 0, 99));
        assertThrows(IndexOutOfBoundsException.class, () -> SourceSlice.of(SOURCE, 0, 3).charAt(3));
    }

    @Test
    void operatorTextMatchesSource() {
        assertEquals("??=", AssignOperator.NULLISH_EQUAL.text());
        assertEquals("instanceof", BinaryOperator.INSTANCE_OF.text());
        assertEquals("typeof", UnaryOperator.TYPE_OF.text());
        assertEquals("module", SourceType.MODULE.text());
    }
}
