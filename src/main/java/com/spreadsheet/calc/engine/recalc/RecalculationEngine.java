package com.spreadsheet.calc.engine.recalc;

import com.spreadsheet.calc.engine.evaluator.EvaluationContext;
import com.spreadsheet.calc.engine.evaluator.FormulaEvaluator;
import com.spreadsheet.calc.engine.format.DisplayFormatter;
import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.models.Cell;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.CellDataType;
import com.spreadsheet.calc.models.CellStyleAccessor;
import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;
import com.spreadsheet.calc.models.Grid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Brings every formula cell's display value up to date after an edit.
 * Each pass evaluates all formula cells in dependency order and writes back
 * display text and data type; passes repeat until one changes nothing
 * or the pass cap is reached. Cells on a reference cycle show "#ERROR!".
 */
public class RecalculationEngine {
    private static final Logger logger = LoggerFactory.getLogger(RecalculationEngine.class);

    public static final int DEFAULT_MAX_PASSES = 10;

    private final FormulaParser parser;
    private final FormulaEvaluator evaluator;
    private final DisplayFormatter formatter;
    private final int maxPasses;

    public RecalculationEngine(FormulaParser parser, FormulaEvaluator evaluator,
                               DisplayFormatter formatter, int maxPasses) {
        if (maxPasses < 1) {
            throw new IllegalArgumentException("maxPasses must be at least 1, got " + maxPasses);
        }
        this.parser = parser;
        this.evaluator = evaluator;
        this.formatter = formatter;
        this.maxPasses = maxPasses;
    }

    public int getMaxPasses() {
        return maxPasses;
    }

    /**
     * Recalculates using the grid's own cell formatting.
     */
    public RecalculationSummary recalculate(Grid grid) {
        return recalculate(grid, grid);
    }

    public RecalculationSummary recalculate(Grid grid, CellStyleAccessor styles) {
        DependencyGraph graph = DependencyGraph.build(grid, parser);
        Set<CellAddress> cyclic = graph.getCyclicCells();
        if (!cyclic.isEmpty()) {
            logger.warn("Circular references in {} cell(s): {}", cyclic.size(), cyclic);
        }

        int passes = 0;
        int updatedCells = 0;
        boolean changed = true;
        while (changed && passes < maxPasses) {
            passes++;
            changed = false;
            EvaluationContext context = evaluator.newContext(grid);
            for (CellAddress address : cyclic) {
                context.putResult(address, EvaluationResult.error(ErrorKind.CIRCULAR_REFERENCE));
            }
            for (CellAddress address : graph.getEvaluationOrder()) {
                if (refresh(grid, styles, context, address)) {
                    changed = true;
                    updatedCells++;
                }
            }
        }
        boolean converged = !changed;
        if (converged) {
            logger.debug("Recalculated {} formula cell(s) in {} pass(es), {} update(s)",
                    graph.getFormulaCells().size(), passes, updatedCells);
        } else {
            logger.warn("Recalculation stopped after {} pass(es) without reaching a fixed point", passes);
        }
        return new RecalculationSummary(graph.getFormulaCells().size(), passes, updatedCells, converged, cyclic);
    }

    /**
     * Evaluates one formula cell and writes back its display text.
     *
     * @return true if the cell's display value or data type changed
     */
    private boolean refresh(Grid grid, CellStyleAccessor styles, EvaluationContext context, CellAddress address) {
        int row = address.getRow();
        int col = address.getCol();
        Cell cell = grid.getCell(row, col);
        EvaluationResult result = evaluator.evaluateCell(context, row, col);
        String display = formatter.format(result, styles.getDecimalPlaces(row, col));
        CellDataType dataType = result.isError() ? CellDataType.ERROR : CellDataType.FORMULA;
        if (cell != null && display.equals(cell.getDisplayValue()) && dataType == cell.getDataType()) {
            return false;
        }
        grid.setCellComputed(row, col, display, dataType);
        return true;
    }
}
