package com.spreadsheet.calc.models;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StructuralEditTest {

    @Test
    void testInsertRemap() {
        StructuralEdit edit = StructuralEdit.insert(2);
        assertEquals(1, edit.remap(1));
        assertEquals(3, edit.remap(2));
        assertEquals(6, edit.remap(5));
    }

    @Test
    void testDeleteRemap() {
        StructuralEdit edit = StructuralEdit.delete(2);
        assertEquals(1, edit.remap(1));
        assertEquals(StructuralEdit.REMOVED, edit.remap(2));
        assertEquals(4, edit.remap(5));
    }

    @Test
    void testMoveRemap() {
        StructuralEdit down = StructuralEdit.move(1, 3);
        assertEquals(0, down.remap(0));
        assertEquals(3, down.remap(1));
        assertEquals(1, down.remap(2));
        assertEquals(2, down.remap(3));
        assertEquals(4, down.remap(4));

        StructuralEdit up = StructuralEdit.move(3, 1);
        assertEquals(0, up.remap(0));
        assertEquals(2, up.remap(1));
        assertEquals(3, up.remap(2));
        assertEquals(1, up.remap(3));
        assertEquals(4, up.remap(4));
    }

    @Test
    void testNegativeIndexRejected() {
        assertThrows(IllegalArgumentException.class, () -> StructuralEdit.insert(-1));
        assertThrows(IllegalArgumentException.class, () -> StructuralEdit.move(0, -2));
    }
}
