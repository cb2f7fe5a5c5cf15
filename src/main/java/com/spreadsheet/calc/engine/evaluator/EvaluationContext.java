package com.spreadsheet.calc.engine.evaluator;

import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.engine.parser.FormulaParser;
import com.spreadsheet.calc.models.CellAddress;
import com.spreadsheet.calc.models.EvaluationResult;
import com.spreadsheet.calc.models.Grid;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * State for one evaluation call (or one recalculation pass) over a borrowed grid:
 * the cells currently being evaluated, results already computed, and parsed formulas.
 * Discard it when the call returns; it must not outlive the grid borrow.
 */
public class EvaluationContext {

    private final Grid grid;
    private final FormulaParser parser;
    // Evaluation stack, in entry order, for cycle detection
    private final Set<CellAddress> inProgress = new LinkedHashSet<>();
    private final Map<CellAddress, EvaluationResult> results = new HashMap<>();
    private final Map<String, Expr> parsed = new HashMap<>();

    public EvaluationContext(Grid grid, FormulaParser parser) {
        this.grid = grid;
        this.parser = parser;
    }

    public Grid getGrid() {
        return grid;
    }

    public Expr parse(String formulaText) {
        Expr expr = parsed.get(formulaText);
        if (expr == null) {
            expr = parser.parse(formulaText);
            parsed.put(formulaText, expr);
        }
        return expr;
    }

    public boolean isInProgress(CellAddress address) {
        return inProgress.contains(address);
    }

    /**
     * @return false if the address was already on the evaluation stack
     */
    public boolean enter(CellAddress address) {
        return inProgress.add(address);
    }

    public void exit(CellAddress address) {
        inProgress.remove(address);
    }

    public EvaluationResult getResult(CellAddress address) {
        return results.get(address);
    }

    /**
     * Records the value of a formula cell; later references read it instead of re-evaluating.
     */
    public void putResult(CellAddress address, EvaluationResult result) {
        results.put(address, result);
    }
}
