package com.spreadsheet.calc.engine.functions;

import com.spreadsheet.calc.engine.evaluator.Values;
import com.spreadsheet.calc.engine.parser.Expr;
import com.spreadsheet.calc.exceptions.FormulaException;
import com.spreadsheet.calc.models.ErrorKind;
import com.spreadsheet.calc.models.EvaluationResult;

import java.util.List;

/**
 * VLOOKUP(value, table, colIndex, [approximate]).
 */
final class LookupFunctions {

    private LookupFunctions() {
    }

    static void registerAll(FunctionLibrary library) {
        library.register("VLOOKUP", LookupFunctions::vlookup);
    }

    /**
     * colIndex is 1-based and must fall inside the table.
     * Approximate mode (the default) assumes the first column is sorted ascending.
     */
    static EvaluationResult vlookup(List<Expr> args, FunctionContext ctx) {
        Arguments.requireCount("VLOOKUP", args, 3, 4);
        EvaluationResult lookupValue = ctx.evaluate(args.get(0));
        LookupTable table = ctx.table(args.get(1));
        int colIndex = (int) Arguments.number(args.get(2), ctx);
        boolean approximate = args.size() < 4 || ctx.condition(args.get(3));

        int width = table.getWidth();
        if (colIndex < 1 || colIndex > width) {
            throw new FormulaException("VLOOKUP column index " + colIndex + " outside table of width " + width);
        }
        return approximate
                ? approximateMatch(lookupValue, table, colIndex)
                : exactMatch(lookupValue, table, colIndex);
    }

    static EvaluationResult exactMatch(EvaluationResult lookupValue, LookupTable table, int colIndex) {
        for (int i = 0; i < table.getScanRowCount(); i++) {
            if (Values.compare(table.get(i, 0), lookupValue) == 0) {
                return table.get(i, colIndex - 1);
            }
        }
        return EvaluationResult.error(ErrorKind.LOOKUP_NOT_FOUND);
    }

    // Last row whose key is <= the lookup value, stopping at the first larger key
    static EvaluationResult approximateMatch(EvaluationResult lookupValue, LookupTable table, int colIndex) {
        int lastMatch = -1;
        for (int i = 0; i < table.getScanRowCount(); i++) {
            int comparison = Values.compare(table.get(i, 0), lookupValue);
            if (comparison == 0) {
                return table.get(i, colIndex - 1);
            }
            if (comparison > 0) {
                break;
            }
            lastMatch = i;
        }
        if (lastMatch < 0) {
            return EvaluationResult.error(ErrorKind.LOOKUP_NOT_FOUND);
        }
        return table.get(lastMatch, colIndex - 1);
    }
}
