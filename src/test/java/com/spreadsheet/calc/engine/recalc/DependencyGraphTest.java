package com.spreadsheet.calc.engine.recalc;

import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.Sheet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    private static final CellAddress A1 = CellAddress.of(0, 0);
    private static final CellAddress B1 = CellAddress.of(0, 1);
    private static final CellAddress C1 = CellAddress.of(0, 2);
    private static final CellAddress D1 = CellAddress.of(0, 3);

    private Sheet sheet;
    private FormulaParser parser;

    @BeforeEach
    void setUp() {
        sheet = new Sheet(5, 5);
        parser = new FormulaParser();
    }

    private void set(CellAddress address, Object raw) {
        sheet.getCell(address.getRow(), address.getCol()).setRawValue(raw);
    }

    @Test
    void testForwardAndReverseEdges() {
        set(A1, 5d);
        set(B1, "=A1*2");
        set(C1, "=B1+10");

        DependencyGraph graph = DependencyGraph.build(sheet, parser);
        assertEquals(Set.of(A1), graph.getForwardGraph().get(B1));
        assertEquals(Set.of(B1), graph.getForwardGraph().get(C1));
        assertEquals(Set.of(B1), graph.getReverseGraph().get(A1));
        assertEquals(Set.of(C1), graph.getReverseGraph().get(B1));
        assertNull(graph.getReverseGraph().get(C1));
        assertEquals(List.of(B1, C1), graph.getFormulaCells());
    }

    /**
     * Referenced formulas come first even when they sit later in the grid.
     */
    @Test
    void testEvaluationOrder() {
        set(A1, "=B1+1");
        set(B1, "=C1*2");
        set(C1, 5d);
        set(D1, "=A1+B1");

        DependencyGraph graph = DependencyGraph.build(sheet, parser);
        assertEquals(List.of(B1, A1, D1), graph.getEvaluationOrder());
        assertTrue(graph.getCyclicCells().isEmpty());
    }

    @Test
    void testCycleDetection() {
        set(A1, "=B1");
        set(B1, "=A1");
        set(C1, "=A1+1");
        set(D1, "=D1");

        DependencyGraph graph = DependencyGraph.build(sheet, parser);
        assertEquals(Set.of(A1, B1, D1), graph.getCyclicCells());
        assertEquals(4, graph.getEvaluationOrder().size());
        assertTrue(graph.getEvaluationOrder().indexOf(C1) > graph.getEvaluationOrder().indexOf(A1));
    }

    @Test
    void testEmptyAndOffGridCellsHaveNoEdges() {
        set(A1, 1d);
        set(B1, "=SUM(A1:A1000) + E5 + Z99");

        DependencyGraph graph = DependencyGraph.build(sheet, parser);
        assertEquals(Set.of(A1), graph.getForwardGraph().get(B1));
    }

    @Test
    void testUnparsableFormulaHasNoDependencies() {
        set(A1, 1d);
        set(B1, "=A1+");

        DependencyGraph graph = DependencyGraph.build(sheet, parser);
        assertTrue(graph.getForwardGraph().get(B1).isEmpty());
        assertEquals(List.of(B1), graph.getEvaluationOrder());
    }

    @Test
    void testLongChainDoesNotOverflow() {
        Sheet tall = new Sheet(Sheet.MAX_ROWS, 1);
        tall.getCell(0, 0).setRawValue(1d);
        for (int r = 1; r < Sheet.MAX_ROWS; r++) {
            tall.getCell(r, 0).setRawValue("=A" + r + "+1");
        }
        DependencyGraph graph = DependencyGraph.build(tall, parser);
        assertEquals(Sheet.MAX_ROWS - 1, graph.getEvaluationOrder().size());
        assertEquals(CellAddress.of(1, 0), graph.getEvaluationOrder().get(0));
    }
}
