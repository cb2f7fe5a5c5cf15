package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * What a function may ask of the evaluator while it runs for one formula cell.
 */
public interface FunctionContext {

    /**
     * Evaluates a scalar argument. A bare range is rejected with a FormulaException.
     */
    EvaluationResult evaluate(Expr argument);

    /**
     * The values an argument contributes to a count: every non-empty, in-grid cell
     * of a range or reference (row-major), or the single value of any other expression.
     */
    List<EvaluationResult> values(Expr argument);

    /**
     * Numeric readings for the statistical kernels: every in-grid cell of a range or
     * reference (row-major), with empty cells and values lacking a numeric reading as 0.
     * Cells past the grid contribute nothing.
     */
    double[] numbers(Expr argument);

    /**
     * Number of empty in-grid cells covered by a range or reference argument.
     */
    int countBlanks(Expr argument);

    /**
     * A range argument as a lookup table; empty and off-grid cells read as empty text.
     */
    LookupTable table(Expr argument);

    /**
     * Evaluates an argument as a condition. Failures count as false.
     */
    boolean condition(Expr argument);
}
