package com.spreadsheet.calc.engine.recalc;

import com.spreadsheet.calc.engine.evaluator.FormulaEvaluator;
import com.spreadsheet.calc.engine.format.DisplayFormatter;
import com.spreadsheet.calc.engine.functions.FunctionLibrary;
import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellDataType;
import com.spreadsheet.calc.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RecalculationEngineTest {

    private Sheet sheet;
    private RecalculationEngine engine;

    @BeforeEach
    void setUp() {
        sheet = new Sheet(5, 5);
        engine = newEngine(RecalculationEngine.DEFAULT_MAX_PASSES);
    }

    private static RecalculationEngine newEngine(int maxPasses) {
        FormulaParser parser = new FormulaParser();
        return new RecalculationEngine(parser, new FormulaEvaluator(parser, new FunctionLibrary()),
                new DisplayFormatter(), maxPasses);
    }

    private Cell cell(int row, int col) {
        return sheet.getCell(row, col);
    }

    /**
     * B1 = A1*2, C1 = B1+10: changing A1 from 10 to 5 moves C1 from 30 to 20.
     */
    @Test
    void testChainUpdates() {
        cell(0, 0).setRawValue(10d);
        cell(0, 1).setRawValue("=A1*2");
        cell(0, 2).setRawValue("=B1+10");

        RecalculationSummary first = engine.recalculate(sheet);
        assertEquals("20", cell(0, 1).getDisplayValue());
        assertEquals("30", cell(0, 2).getDisplayValue());
        assertEquals(CellDataType.FORMULA, cell(0, 2).getDataType());
        assertEquals(2, first.getFormulaCells());
        assertTrue(first.isConverged());

        cell(0, 0).setRawValue(5d);
        engine.recalculate(sheet);
        assertEquals("10", cell(0, 1).getDisplayValue());
        assertEquals("20", cell(0, 2).getDisplayValue());
    }

    @Test
    void testStopsAtFixedPoint() {
        cell(0, 0).setRawValue("=1+1");
        RecalculationSummary summary = engine.recalculate(sheet);
        assertEquals(2, summary.getPasses());
        assertEquals(1, summary.getUpdatedCells());

        RecalculationSummary again = engine.recalculate(sheet);
        assertEquals(1, again.getPasses());
        assertEquals(0, again.getUpdatedCells());
        assertTrue(again.isConverged());
    }

    @Test
    void testPassCap() {
        cell(0, 0).setRawValue("=1+1");
        RecalculationSummary summary = newEngine(1).recalculate(sheet);
        assertEquals(1, summary.getPasses());
        assertFalse(summary.isConverged());
        assertEquals("2", cell(0, 0).getDisplayValue());

        assertThrows(IllegalArgumentException.class, () -> newEngine(0));
    }

    @Test
    void testCyclesShowError() {
        cell(0, 0).setRawValue("=B1");
        cell(0, 1).setRawValue("=A1");
        cell(0, 2).setRawValue("=A1+1");
        cell(1, 0).setRawValue("=A2*2");

        RecalculationSummary summary = engine.recalculate(sheet);
        assertTrue(summary.getCyclicCells().contains(CellAddress.of(0, 0)));
        assertTrue(summary.getCyclicCells().contains(CellAddress.of(0, 1)));
        assertTrue(summary.getCyclicCells().contains(CellAddress.of(1, 0)));
        assertFalse(summary.getCyclicCells().contains(CellAddress.of(0, 2)));

        assertEquals("#ERROR!", cell(0, 0).getDisplayValue());
        assertEquals(CellDataType.ERROR, cell(0, 0).getDataType());
        assertEquals("#ERROR!", cell(0, 1).getDisplayValue());
        assertEquals("#ERROR!", cell(0, 2).getDisplayValue());
        assertEquals("#ERROR!", cell(1, 0).getDisplayValue());
    }

    /**
     * Fixing the formula that closed a cycle brings every cell back.
     */
    @Test
    void testBreakingACycle() {
        cell(0, 0).setRawValue("=B1");
        cell(0, 1).setRawValue("=A1");
        engine.recalculate(sheet);
        assertEquals(CellDataType.ERROR, cell(0, 1).getDataType());

        cell(0, 1).setRawValue("=7");
        engine.recalculate(sheet);
        assertEquals("7", cell(0, 0).getDisplayValue());
        assertEquals(CellDataType.FORMULA, cell(0, 0).getDataType());
    }

    @Test
    void testErrorsAndLookupMisses() {
        cell(0, 0).setRawValue("=1/0");
        cell(0, 1).setRawValue("=VLOOKUP(1, C1:D2, 2, FALSE)");
        cell(0, 2).setRawValue("=\"text result\"");
        engine.recalculate(sheet);

        assertEquals("#ERROR!", cell(0, 0).getDisplayValue());
        assertEquals(CellDataType.ERROR, cell(0, 0).getDataType());
        assertEquals("#N/A", cell(0, 1).getDisplayValue());
        assertEquals(CellDataType.ERROR, cell(0, 1).getDataType());
        assertEquals("text result", cell(0, 2).getDisplayValue());
    }

    @Test
    void testDecimalPlaces() {
        cell(0, 0).setRawValue("=1/3");
        cell(0, 0).setDecimalPlaces(2);
        engine.recalculate(sheet);
        assertEquals("0.33", cell(0, 0).getDisplayValue());

        engine.recalculate(sheet, (row, col) -> 1);
        assertEquals("0.3", cell(0, 0).getDisplayValue());

        cell(0, 0).setDecimalPlaces(null);
        engine.recalculate(sheet);
        assertEquals("0.3333333333333333", cell(0, 0).getDisplayValue());
    }

    @Test
    void testLiteralCellsAreNotTouched() {
        cell(0, 0).setRawValue(4d);
        cell(0, 0).setDisplayValue("4");
        cell(0, 0).setDataType(CellDataType.NUMBER);
        engine.recalculate(sheet);
        assertEquals("4", cell(0, 0).getDisplayValue());
        assertEquals(CellDataType.NUMBER, cell(0, 0).getDataType());
    }
}
