package com.spreadsheet.calc.engine.reference;

import com.spreadsheet.calc.exceptions.InvalidReferenceException;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceResolverTest {

    @Test
    void testColumnLetters() {
        assertEquals("A", ReferenceResolver.columnToLetters(0));
        assertEquals("Z", ReferenceResolver.columnToLetters(25));
        assertEquals("AA", ReferenceResolver.columnToLetters(26));
        assertEquals("AZ", ReferenceResolver.columnToLetters(51));
        assertEquals("ZZ", ReferenceResolver.columnToLetters(701));
        assertEquals("AAA", ReferenceResolver.columnToLetters(702));

        assertEquals(0, ReferenceResolver.lettersToColumn("A"));
        assertEquals(27, ReferenceResolver.lettersToColumn("AB"));
        assertEquals(702, ReferenceResolver.lettersToColumn("AAA"));
    }

    /**
     * Every column index survives a trip through its letters.
     */
    @Test
    void testColumnLettersRoundTrip() {
        for (int col = 0; col < 2000; col++) {
            assertEquals(col, ReferenceResolver.lettersToColumn(ReferenceResolver.columnToLetters(col)));
        }
    }

    @Test
    void testTextToAddress() {
        CellAddress b5 = ReferenceResolver.textToAddress("B5");
        assertEquals(4, b5.getRow());
        assertEquals(1, b5.getCol());
        assertFalse(b5.isAbsoluteRow());
        assertFalse(b5.isAbsoluteCol());

        CellAddress aa10 = ReferenceResolver.textToAddress("AA10");
        assertEquals(9, aa10.getRow());
        assertEquals(26, aa10.getCol());
    }

    @Test
    void testAbsoluteMarkersArePreserved() {
        CellAddress mixed = ReferenceResolver.textToAddress("$C7");
        assertTrue(mixed.isAbsoluteCol());
        assertFalse(mixed.isAbsoluteRow());
        assertEquals("$C7", ReferenceResolver.addressToText(mixed));

        CellAddress both = ReferenceResolver.textToAddress("$C$7");
        assertTrue(both.isAbsoluteCol());
        assertTrue(both.isAbsoluteRow());
        assertEquals("$C$7", both.toString());
        assertEquals(CellAddress.of(6, 2), both.toRelative());
    }

    @Test
    void testInvalidReferences() {
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress("A0"));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress("1A"));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress("A"));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress(""));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress("A1B"));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress(null));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.textToAddress("A9999999999"));
        assertThrows(InvalidReferenceException.class, () -> ReferenceResolver.lettersToColumn("a"));
    }

    @Test
    void testRangeExpansionIsRowMajorAndNormalized() {
        CellRange range = ReferenceResolver.textToRange("B2:A1");
        assertEquals(0, range.getMinRow());
        assertEquals(1, range.getMaxRow());
        assertEquals(2, range.getWidth());

        List<String> cells = new ArrayList<>();
        for (CellAddress address : ReferenceResolver.expandRange(range)) {
            cells.add(address.toString());
        }
        assertEquals(List.of("A1", "B1", "A2", "B2"), cells);

        // Restartable
        int count = 0;
        for (CellAddress ignored : range) {
            count++;
        }
        assertEquals(4, count);
    }

    @Test
    void testSingleReferenceRange() {
        CellRange range = ReferenceResolver.textToRange("C3");
        assertEquals(1, range.getHeight());
        assertEquals(1, range.getWidth());
        assertTrue(range.contains(2, 2));
        assertFalse(range.contains(2, 3));
    }
}
