package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * A built-in spreadsheet function. Receives its arguments unevaluated so that
 * it can decide which ones to evaluate (IF) and how (ranges vs. scalars).
 */
@FunctionalInterface
public interface FormulaFunction {

    EvaluationResult apply(List<Expr> arguments, FunctionContext context);
}
